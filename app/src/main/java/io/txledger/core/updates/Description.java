package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Objects;

/** Human-readable metadata of an identity provider or anonymity revoker. */
@JsonPropertyOrder({"name", "url", "description"})
public final class Description implements Encodable {
    private final String name;
    private final String url;
    private final String description;

    @JsonCreator
    public Description(@JsonProperty("name") String name,
                       @JsonProperty("url") String url,
                       @JsonProperty("description") String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.url = url == null ? "" : url;
        this.description = description == null ? "" : description;
    }

    @JsonProperty("name")
    public String name() { return name; }

    @JsonProperty("url")
    public String url() { return url; }

    @JsonProperty("description")
    public String description() { return description; }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putUtf8(name);
        sink.putUtf8(url);
        sink.putUtf8(description);
    }

    public static Description read(ByteBuffer buf) {
        String name = Bytes.readUtf8(buf);
        String url = Bytes.readUtf8(buf);
        return new Description(name, url, Bytes.readUtf8(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Description)) return false;
        Description other = (Description) o;
        return name.equals(other.name) && url.equals(other.url) && description.equals(other.description);
    }

    @Override public int hashCode() { return Objects.hash(name, url, description); }
}

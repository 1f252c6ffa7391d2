package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * The three tiers of governance keys.
 */
@JsonPropertyOrder({"rootKeys", "level1Keys", "level2Keys"})
public final class UpdateKeysCollection implements Encodable {
    private final HigherLevelKeys rootKeys;
    private final HigherLevelKeys level1Keys;
    private final Authorizations level2Keys;

    @JsonCreator
    public UpdateKeysCollection(@JsonProperty("rootKeys") HigherLevelKeys rootKeys,
                                @JsonProperty("level1Keys") HigherLevelKeys level1Keys,
                                @JsonProperty("level2Keys") Authorizations level2Keys) {
        this.rootKeys = Objects.requireNonNull(rootKeys, "rootKeys");
        this.level1Keys = Objects.requireNonNull(level1Keys, "level1Keys");
        this.level2Keys = Objects.requireNonNull(level2Keys, "level2Keys");
    }

    @JsonProperty("rootKeys")
    public HigherLevelKeys rootKeys() { return rootKeys; }

    @JsonProperty("level1Keys")
    public HigherLevelKeys level1Keys() { return level1Keys; }

    @JsonProperty("level2Keys")
    public Authorizations level2Keys() { return level2Keys; }

    public UpdateKeysCollection withRootKeys(HigherLevelKeys keys) {
        return new UpdateKeysCollection(keys, level1Keys, level2Keys);
    }

    public UpdateKeysCollection withLevel1Keys(HigherLevelKeys keys) {
        return new UpdateKeysCollection(rootKeys, keys, level2Keys);
    }

    public UpdateKeysCollection withLevel2Keys(Authorizations keys) {
        return new UpdateKeysCollection(rootKeys, level1Keys, keys);
    }

    @Override
    public void writeTo(ByteSink sink) {
        rootKeys.writeTo(sink);
        level1Keys.writeTo(sink);
        level2Keys.writeTo(sink);
    }

    public static UpdateKeysCollection read(ByteBuffer buf) {
        HigherLevelKeys root = HigherLevelKeys.read(buf);
        HigherLevelKeys level1 = HigherLevelKeys.read(buf);
        return new UpdateKeysCollection(root, level1, Authorizations.read(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UpdateKeysCollection)) return false;
        UpdateKeysCollection other = (UpdateKeysCollection) o;
        return rootKeys.equals(other.rootKeys) && level1Keys.equals(other.level1Keys)
                && level2Keys.equals(other.level2Keys);
    }

    @Override public int hashCode() { return Objects.hash(rootKeys, level1Keys, level2Keys); }
}

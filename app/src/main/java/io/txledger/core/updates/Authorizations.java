package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Level-2 keys and, for every {@link AuthorizationKind}, the subset of them that may sign.
 */
public final class Authorizations implements Encodable {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final List<UpdatePublicKey> keys;
    private final Map<AuthorizationKind, AccessStructure> structures;

    public Authorizations(List<UpdatePublicKey> keys, Map<AuthorizationKind, AccessStructure> structures) {
        this.keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
        EnumMap<AuthorizationKind, AccessStructure> copy = new EnumMap<>(AuthorizationKind.class);
        for (AuthorizationKind kind : AuthorizationKind.values()) {
            AccessStructure as = structures.get(kind);
            if (as == null) {
                throw new IllegalArgumentException("Missing access structure " + kind.jsonName());
            }
            if (!as.authorizedKeys().isEmpty() && as.authorizedKeys().last() >= this.keys.size()) {
                throw new IllegalArgumentException("Access structure " + kind.jsonName()
                        + " refers to key " + as.authorizedKeys().last() + " of " + this.keys.size());
            }
            copy.put(kind, as);
        }
        this.structures = Collections.unmodifiableMap(copy);
    }

    /** Every kind authorized by the same structure. Handy for genesis and tests. */
    public static Authorizations uniform(List<UpdatePublicKey> keys, AccessStructure structure) {
        EnumMap<AuthorizationKind, AccessStructure> all = new EnumMap<>(AuthorizationKind.class);
        for (AuthorizationKind kind : AuthorizationKind.values()) {
            all.put(kind, structure);
        }
        return new Authorizations(keys, all);
    }

    public List<UpdatePublicKey> keys() { return keys; }

    public AccessStructure accessStructure(AuthorizationKind kind) {
        return structures.get(kind);
    }

    @Override
    public void writeTo(ByteSink sink) {
        KeyLists.write(sink, keys);
        for (AuthorizationKind kind : AuthorizationKind.values()) {
            structures.get(kind).writeTo(sink);
        }
    }

    public static Authorizations read(ByteBuffer buf) {
        List<UpdatePublicKey> keys = KeyLists.read(buf);
        EnumMap<AuthorizationKind, AccessStructure> structures = new EnumMap<>(AuthorizationKind.class);
        for (AuthorizationKind kind : AuthorizationKind.values()) {
            structures.put(kind, AccessStructure.read(buf));
        }
        try {
            return new Authorizations(keys, structures);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(e.getMessage(), e);
        }
    }

    @JsonValue
    ObjectNode toJson() {
        ObjectNode node = JSON.createObjectNode();
        node.set("keys", JSON.valueToTree(keys));
        for (AuthorizationKind kind : AuthorizationKind.values()) {
            node.set(kind.jsonName(), JSON.valueToTree(structures.get(kind)));
        }
        return node;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static Authorizations fromJson(JsonNode node) {
        UpdatePublicKey[] keys = JSON.convertValue(required(node, "keys"), UpdatePublicKey[].class);
        EnumMap<AuthorizationKind, AccessStructure> structures = new EnumMap<>(AuthorizationKind.class);
        for (AuthorizationKind kind : AuthorizationKind.values()) {
            structures.put(kind, JSON.convertValue(required(node, kind.jsonName()), AccessStructure.class));
        }
        return new Authorizations(Arrays.asList(keys), structures);
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field " + field);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Authorizations)) return false;
        Authorizations other = (Authorizations) o;
        return keys.equals(other.keys) && structures.equals(other.structures);
    }

    @Override public int hashCode() { return Objects.hash(keys, structures); }
    @Override public String toString() { return "Authorizations{" + keys.size() + " keys}"; }
}

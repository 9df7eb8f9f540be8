package com.bastion.security.claims;

import com.bastion.security.AuthException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Wire encodings of the resource (bucket) claim {@code b}.
 * <p>
 * Either a plain JSON array of names, or a tagged union
 * {@code {"_type": "groups"|"patterns"|"compressed", "_data": ...}}. {@link #parse(Object)}
 * turns the raw claim value into one of the records below; {@link #expand()} produces the flat
 * list of resource names. Every structural problem is a
 * {@link com.bastion.security.AuthErrorCode#DECOMPRESSION_ERROR}, never a silent skip.
 */
public sealed interface ResourceEncoding {

    String TYPE_KEY = "_type";
    String DATA_KEY = "_data";

    /** Flat, possibly duplicated list of resource names and glob patterns. */
    List<String> expand();

    /** The {@code _type} tag, or "plain" for an uncompressed array. */
    String type();

    /**
     * Parses a raw {@code b} claim value.
     *
     * @param raw the value as decoded from the token payload JSON
     * @return the typed encoding
     * @throws AuthException with DECOMPRESSION_ERROR if the value has an unsupported shape
     */
    static ResourceEncoding parse(Object raw) {
        if (raw instanceof List<?> list) {
            return new Plain(stringList(list, "b"));
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw AuthException.decompression("Resource claim must be an array or a tagged object");
        }
        Object type = map.get(TYPE_KEY);
        if (!(type instanceof String tag)) {
            throw AuthException.decompression("Resource claim object is missing '_type'");
        }
        Object data = map.get(DATA_KEY);
        return switch (tag) {
            case Groups.TYPE -> new Groups(stringListMap(data, tag));
            case Patterns.TYPE -> new Patterns(stringListMap(data, tag));
            case Compressed.TYPE -> {
                if (!(data instanceof String blob) || blob.isBlank()) {
                    throw AuthException.decompression("Compressed resource data must be a non-empty string");
                }
                yield new Compressed(blob);
            }
            default -> throw AuthException.decompression("Unsupported resource encoding type: " + tag);
        };
    }

    /** Uncompressed array, taken as-is. */
    record Plain(List<String> names) implements ResourceEncoding {

        public Plain {
            names = List.copyOf(names);
        }

        @Override
        public List<String> expand() {
            return names;
        }

        @Override
        public String type() {
            return "plain";
        }
    }

    /** {@code prefix -> [suffix, ...]}, expanding to {@code prefix-suffix}. */
    record Groups(Map<String, List<String>> groups) implements ResourceEncoding {

        public static final String TYPE = "groups";

        public Groups {
            groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
        }

        @Override
        public List<String> expand() {
            List<String> names = new ArrayList<>();
            groups.forEach((prefix, suffixes) -> {
                for (String suffix : suffixes) {
                    names.add(prefix + "-" + suffix);
                }
            });
            return names;
        }

        @Override
        public String type() {
            return TYPE;
        }
    }

    /**
     * {@code key -> [value, ...]}. A key containing {@code *} is a template whose first
     * {@code *} is replaced by each value. The key {@code quilt} prefixes each value with
     * {@code quilt-}. Any other key is a label and its values are taken verbatim. Values may
     * themselves be globs (e.g. {@code team-*}).
     */
    record Patterns(Map<String, List<String>> patterns) implements ResourceEncoding {

        public static final String TYPE = "patterns";

        /** Key whose values are bucket suffixes under the {@code quilt-} prefix. */
        public static final String QUILT_KEY = "quilt";

        public Patterns {
            patterns = Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
        }

        @Override
        public List<String> expand() {
            List<String> names = new ArrayList<>();
            patterns.forEach((key, values) -> {
                int star = key.indexOf('*');
                for (String value : values) {
                    if (star >= 0) {
                        names.add(key.substring(0, star) + value + key.substring(star + 1));
                    } else if (QUILT_KEY.equals(key)) {
                        names.add(QUILT_KEY + "-" + value);
                    } else {
                        names.add(value);
                    }
                }
            });
            return names;
        }

        @Override
        public String type() {
            return TYPE;
        }
    }

    /**
     * Base64 (standard or URL alphabet) of a JSON array of names, optionally gzip-compressed
     * before encoding.
     */
    record Compressed(String blob) implements ResourceEncoding {

        public static final String TYPE = "compressed";

        /** Upper bound on the inflated payload. */
        static final int MAX_INFLATED_BYTES = 64 * 1024;

        private static final ObjectMapper MAPPER = new ObjectMapper();

        @Override
        public List<String> expand() {
            byte[] bytes = inflateIfGzipped(decodeBase64(blob.strip()));
            JsonNode node;
            try {
                node = MAPPER.readTree(new String(bytes, StandardCharsets.UTF_8));
            } catch (JsonProcessingException e) {
                throw AuthException.decompression("Compressed resource data is not valid JSON");
            }
            if (node == null || !node.isArray()) {
                throw AuthException.decompression("Compressed resource data must decode to a JSON array");
            }
            List<String> names = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                if (!element.isTextual()) {
                    throw AuthException.decompression("Compressed resource data must contain only strings");
                }
                names.add(element.asText());
            }
            return names;
        }

        @Override
        public String type() {
            return TYPE;
        }

        private static byte[] decodeBase64(String value) {
            boolean urlAlphabet = value.indexOf('-') >= 0 || value.indexOf('_') >= 0;
            try {
                return (urlAlphabet ? Base64.getUrlDecoder() : Base64.getDecoder()).decode(value);
            } catch (IllegalArgumentException e) {
                throw AuthException.decompression("Compressed resource data is not valid base64");
            }
        }

        private static byte[] inflateIfGzipped(byte[] bytes) {
            boolean gzipped = bytes.length >= 2
                    && bytes[0] == (byte) GZIPInputStream.GZIP_MAGIC
                    && bytes[1] == (byte) (GZIPInputStream.GZIP_MAGIC >> 8);
            if (!gzipped) {
                return bytes;
            }
            try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
                byte[] inflated = in.readNBytes(MAX_INFLATED_BYTES + 1);
                if (inflated.length > MAX_INFLATED_BYTES) {
                    throw AuthException.decompression("Compressed resource data inflates beyond "
                            + MAX_INFLATED_BYTES + " bytes");
                }
                return inflated;
            } catch (IOException e) {
                throw AuthException.decompression("Compressed resource data is not valid gzip");
            }
        }
    }

    private static List<String> stringList(List<?> values, String context) {
        List<String> result = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!(value instanceof String s) || s.isBlank()) {
                throw AuthException.decompression("Entries of '" + context + "' must be non-blank strings");
            }
            result.add(s);
        }
        return result;
    }

    private static Map<String, List<String>> stringListMap(Object data, String type) {
        if (!(data instanceof Map<?, ?> map)) {
            throw AuthException.decompression("'" + type + "' resource data must be an object");
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key) || key.isBlank()) {
                throw AuthException.decompression("'" + type + "' resource keys must be non-blank strings");
            }
            if (!(entry.getValue() instanceof List<?> values)) {
                throw AuthException.decompression("'" + type + "' entry '" + key + "' must be an array");
            }
            result.put(key, stringList(values, type + "." + key));
        }
        return result;
    }
}

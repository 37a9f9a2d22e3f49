// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * JSON mapping and file naming shared by the durable stores.
 */
public final class StoreJson {
    private StoreJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return a mapper writing instants as ISO-8601 text, tolerating fields it does not know and rejecting anything
     *     after the value
     */
    @NonNull
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Encodes a key (an election id or a scope key) into a single safe file name component.
     */
    @NonNull
    static String fileNameOf(@NonNull final String key, @NonNull final String extension) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8) + extension;
    }

    /**
     * Inverse of {@link #fileNameOf(String, String)}.
     */
    @NonNull
    static String keyOf(@NonNull final String fileName, @NonNull final String extension) {
        return URLDecoder.decode(fileName.substring(0, fileName.length() - extension.length()), StandardCharsets.UTF_8);
    }
}

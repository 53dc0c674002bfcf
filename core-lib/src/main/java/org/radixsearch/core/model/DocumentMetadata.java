package org.radixsearch.core.model;

import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;

public record DocumentMetadata(
        int size,
        @SerializedName("word_count") int wordCount,
        @SerializedName("unique_words") int uniqueWords
) implements Serializable {

    @NotNull
    @Override
    public String toString() {
        return String.format("DocumentMetadata{size=%d, words=%d, unique=%d}", size, wordCount, uniqueWords);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}

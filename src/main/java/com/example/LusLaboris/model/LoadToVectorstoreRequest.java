package com.example.LusLaboris.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for loading a processed law file into the vector store.
 *
 * @param filename          JSON file name, without path
 * @param localDataPath     optional data directory; falls back to the configured one
 * @param replaceCollection drop existing rows of the collection before inserting
 * @param batchSize         optional insert batch size
 */
public record LoadToVectorstoreRequest(
        @NotBlank
        String filename,
        String localDataPath,
        boolean replaceCollection,
        Integer batchSize
) {
    public String resolveLocalDataPath(String defaultValue) {
        return localDataPath == null || localDataPath.isBlank() ? defaultValue : localDataPath;
    }

    public int resolveBatchSize(int defaultValue) {
        return batchSize == null || batchSize <= 0 ? defaultValue : batchSize;
    }
}

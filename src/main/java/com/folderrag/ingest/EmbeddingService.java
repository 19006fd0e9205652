package com.folderrag.ingest;

import com.folderrag.runtime.CancellationToken;

public interface EmbeddingService {
    float[] embed(String text, String model, CancellationToken cancellation);

    default float[] embed(String text, String model) {
        return embed(text, model, CancellationToken.none());
    }
}

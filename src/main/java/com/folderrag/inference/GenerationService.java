package com.folderrag.inference;

import com.folderrag.runtime.CancellationToken;

public interface GenerationService {
    String generate(String model, String prompt, CancellationToken cancellation);

    default String generate(String model, String prompt) {
        return generate(model, prompt, CancellationToken.none());
    }
}

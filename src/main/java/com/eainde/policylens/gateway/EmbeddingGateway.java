package com.eainde.policylens.gateway;

import java.util.List;

/**
 * Text to vector. Implementations throw {@link com.eainde.policylens.exception.RetrievalException}
 * when the provider fails after retries.
 */
public interface EmbeddingGateway {

    float[] embed(String text);

    /**
     * @return one vector per input text, in input order
     */
    List<float[]> embedAll(List<String> texts);
}

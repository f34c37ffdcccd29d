package ch.so.arp.rag.engine.retrieval;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Counts tokens with a byte-pair encoding instead of a character ratio.
 */
public class TiktokenEstimator implements TokenEstimator {

    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;

    public TiktokenEstimator() {
        this(EncodingType.CL100K_BASE);
    }

    public TiktokenEstimator(EncodingType encodingType) {
        this.encoding = REGISTRY.getEncoding(encodingType);
    }

    @Override
    public int estimate(String text) {
        return text == null || text.isEmpty() ? 0 : encoding.countTokens(text);
    }
}

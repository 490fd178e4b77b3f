package com.duelo.engine.cost;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Heuristic token counts for texts whose real usage is not (yet) known.
 */
@Component
@Slf4j
public class TokenCounter {

    private final Encoding encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);

    public int count(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        try {
            return encoding.countTokens(text);
        } catch (RuntimeException ex) {
            log.debug("Token encoding failed, using character heuristic: {}", ex.getMessage());
            return approximate(text);
        }
    }

    static int approximate(String text) {
        return Math.max(1, text.length() / 4);
    }
}

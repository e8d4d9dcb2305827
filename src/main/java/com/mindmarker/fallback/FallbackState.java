package com.mindmarker.fallback;

public enum FallbackState {
    /** enough features, encode as extracted */
    ACCEPTED,
    /** decodable and large enough but short on features */
    MARGINAL,
    /** terminal, no file is emitted */
    REJECTED
}

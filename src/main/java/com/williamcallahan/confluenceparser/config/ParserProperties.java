package com.williamcallahan.confluenceparser.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parser settings bound from {@code confluence.parser.*}.
 */
@ConfigurationProperties(prefix = "confluence.parser")
public class ParserProperties {

    /** Throw a ParsingDiagnosticsException instead of returning a document that has diagnostics. */
    private boolean raiseOnFinish = false;

    public boolean isRaiseOnFinish() {
        return raiseOnFinish;
    }

    public void setRaiseOnFinish(boolean raiseOnFinish) {
        this.raiseOnFinish = raiseOnFinish;
    }
}

package com.fractalgl.settings;

import java.util.Objects;

/** A formula in its textual notation together with the settings to render it with. */
public record RenderRequest(String equation, RenderSettings settings) {
    public static final String DEFAULT_EQUATION = "z^{2}+c";

    public RenderRequest {
        Objects.requireNonNull(equation, "equation");
        Objects.requireNonNull(settings, "settings");
    }

    public static RenderRequest defaults() {
        return new RenderRequest(DEFAULT_EQUATION, RenderSettings.DEFAULTS);
    }
}

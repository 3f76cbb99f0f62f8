package com.labassist.orchestration.synthesis;

import org.springframework.util.StringUtils;

/**
 * Strategy selection for {@link SynthesisEngine}. Built once from configuration;
 * the engine never consults the process environment.
 */
public record SynthesisSettings(
        boolean useLlm,
        String apiKey,
        String model,
        double temperature
) {

    public static final String DEFAULT_MODEL = "gpt-4";
    public static final double DEFAULT_TEMPERATURE = 0.3;

    public SynthesisSettings {
        model = StringUtils.hasText(model) ? model : DEFAULT_MODEL;
    }

    public static SynthesisSettings deterministic() {
        return new SynthesisSettings(false, null, DEFAULT_MODEL, DEFAULT_TEMPERATURE);
    }

    public boolean hasCredential() {
        return StringUtils.hasText(apiKey);
    }

    @Override
    public String toString() {
        return "SynthesisSettings[useLlm=" + useLlm + ", apiKey=" + (hasCredential() ? "***" : "<none>")
                + ", model=" + model + ", temperature=" + temperature + "]";
    }
}

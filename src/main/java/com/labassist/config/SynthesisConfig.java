package com.labassist.config;

import com.labassist.orchestration.synthesis.SynthesisSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SynthesisConfig {

    @Bean
    public SynthesisSettings synthesisSettings(LabAssistantProperties properties) {
        LabAssistantProperties.LlmConfig llm = properties.getLlm();
        return new SynthesisSettings(llm.isUseLlm(), llm.getApiKey(), llm.getModel(), llm.getTemperature());
    }
}

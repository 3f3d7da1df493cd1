package com.wordchains.dailypuzzle.config;

import com.wordchains.dailypuzzle.validation.CandidateValidator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PuzzleProperties.class)
public class PuzzleConfig {

    /**
     * Dates are civil UTC dates everywhere in this service
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CandidateValidator candidateValidator(PuzzleProperties properties) {
        return new CandidateValidator(properties.getGeneration().isHardBlockEndpoints());
    }
}

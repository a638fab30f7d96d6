package com.aiadvent.router.dispatch.config;

import com.aiadvent.router.dispatch.token.DefaultTokenEstimator;
import com.aiadvent.router.dispatch.token.TokenEstimator;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TokenEstimationConfiguration {

  @Bean
  public EncodingRegistry encodingRegistry() {
    return Encodings.newDefaultEncodingRegistry();
  }

  @Bean
  public TokenEstimator tokenEstimator(
      EncodingRegistry encodingRegistry, RouterProperties properties) {
    return new DefaultTokenEstimator(
        encodingRegistry, properties.getToken().getDefaultTokenizer());
  }
}

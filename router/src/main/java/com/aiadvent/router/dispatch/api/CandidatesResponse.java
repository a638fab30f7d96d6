package com.aiadvent.router.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CandidatesResponse(List<Candidate> candidates) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Candidate(
      String key,
      String provider,
      String model,
      Map<String, Double> capabilities,
      double inputPerToken,
      double outputPerToken) {}
}

package com.aiadvent.router.dispatch.api;

import com.aiadvent.router.dispatch.routing.RequestOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(
    description = "Prompt to dispatch to the best eligible backend model.",
    example =
        """
        {
          "prompt": "Compare the trade-offs of event sourcing and CRUD persistence.",
          "options": {
            "fallbackStrategy": "capability-descending",
            "minCapability": { "reasoning": 7 },
            "maxCost": 0.05,
            "timeoutMs": 20000
          }
        }
        """)
public record GenerateRequest(
    @Schema(description = "Text sent to the model.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "prompt must not be blank")
        String prompt,
    @Schema(description = "Optional selection, caching and sampling overrides.")
        RequestOptions options) {}

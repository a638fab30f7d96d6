package com.aiadvent.router.dispatch.config;

import com.aiadvent.router.dispatch.execution.ExecutionSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.router")
@Validated
public class RouterProperties {

  @Valid private Cache cache = new Cache();
  @Valid private Execution execution = new Execution();
  private Logging logging = new Logging();
  private Token token = new Token();

  /** Backends keyed by provider identifier, registered in declaration order. */
  @Valid private Map<String, Provider> providers = new LinkedHashMap<>();

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Execution getExecution() {
    return execution;
  }

  public void setExecution(Execution execution) {
    this.execution = execution;
  }

  public Logging getLogging() {
    return logging;
  }

  public void setLogging(Logging logging) {
    this.logging = logging;
  }

  public Token getToken() {
    return token;
  }

  public void setToken(Token token) {
    this.token = token;
  }

  public Map<String, Provider> getProviders() {
    return providers;
  }

  public void setProviders(Map<String, Provider> providers) {
    this.providers = providers;
  }

  public static class Cache {

    private boolean enabled = true;

    /** Whether lookups and writes also go through embedding similarity. */
    private boolean semanticEnabled = true;

    @NotNull private Duration ttl = Duration.ofHours(24);

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.95;

    /** Interval of the background expiry sweep. Zero or negative disables it. */
    private Duration sweepInterval = Duration.ofHours(1);

    @Min(1)
    private long maximumSize = 10_000;

    /**
     * {@code provider:model} key of the candidate that embeds lookups when the request names no
     * preferred provider or model. Defaults to the first registered candidate.
     */
    private String embeddingCandidate;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean isSemanticEnabled() {
      return semanticEnabled;
    }

    public void setSemanticEnabled(boolean semanticEnabled) {
      this.semanticEnabled = semanticEnabled;
    }

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public double getSimilarityThreshold() {
      return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
      this.similarityThreshold = similarityThreshold;
    }

    public Duration getSweepInterval() {
      return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
    }

    public long getMaximumSize() {
      return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
      this.maximumSize = maximumSize;
    }

    public String getEmbeddingCandidate() {
      return embeddingCandidate;
    }

    public void setEmbeddingCandidate(String embeddingCandidate) {
      this.embeddingCandidate = embeddingCandidate;
    }
  }

  public static class Execution {

    @NotNull private Duration minInterval = Duration.ofSeconds(1);
    @NotNull private Duration timeout = Duration.ofSeconds(30);

    @Min(0)
    private int maxRetries = 3;

    @NotNull private Duration initialBackoff = Duration.ofSeconds(2);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @NotNull private Duration maxBackoff = Duration.ofSeconds(60);

    public Duration getMinInterval() {
      return minInterval;
    }

    public void setMinInterval(Duration minInterval) {
      this.minInterval = minInterval;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public double getBackoffMultiplier() {
      return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public ExecutionSettings toSettings() {
      return new ExecutionSettings(
          minInterval, timeout, maxRetries, initialBackoff, backoffMultiplier, maxBackoff);
    }
  }

  public static class Logging {

    private ModelLogging model = new ModelLogging();

    public ModelLogging getModel() {
      return model;
    }

    public void setModel(ModelLogging model) {
      this.model = model;
    }
  }

  public static class ModelLogging {

    /** Whether prompts sent to backend chat models are logged at debug level. */
    private boolean enabled = false;

    /** Whether completions are logged in addition to prompts. */
    private boolean logCompletion = false;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean isLogCompletion() {
      return logCompletion;
    }

    public void setLogCompletion(boolean logCompletion) {
      this.logCompletion = logCompletion;
    }
  }

  public static class Token {

    /**
     * Tokenizer used when a provider does not configure one. Accepts either {@code ModelType} or
     * {@code EncodingType} names supported by jtokkit.
     */
    private String defaultTokenizer = "cl100k_base";

    public String getDefaultTokenizer() {
      return defaultTokenizer;
    }

    public void setDefaultTokenizer(String defaultTokenizer) {
      this.defaultTokenizer = defaultTokenizer;
    }
  }

  public static class Provider {

    private ProviderType type = ProviderType.OPENAI;
    private String displayName;
    private String baseUrl;
    private String apiKey;
    private String completionsPath;
    private String embeddingsPath;

    /** Embedding model used for semantic caching; embeddings are disabled when unset. */
    private String embeddingModel;

    private String tokenizer;
    private Integer maxTokens;
    private Double temperature;
    private Double topP;
    @Valid private Map<String, Model> models = new LinkedHashMap<>();

    public ProviderType getType() {
      return type;
    }

    public void setType(ProviderType type) {
      this.type = type;
    }

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getCompletionsPath() {
      return completionsPath;
    }

    public void setCompletionsPath(String completionsPath) {
      this.completionsPath = completionsPath;
    }

    public String getEmbeddingsPath() {
      return embeddingsPath;
    }

    public void setEmbeddingsPath(String embeddingsPath) {
      this.embeddingsPath = embeddingsPath;
    }

    public String getEmbeddingModel() {
      return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
      this.embeddingModel = embeddingModel;
    }

    public String getTokenizer() {
      return tokenizer;
    }

    public void setTokenizer(String tokenizer) {
      this.tokenizer = tokenizer;
    }

    public Integer getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
      this.maxTokens = maxTokens;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }

    public Double getTopP() {
      return topP;
    }

    public void setTopP(Double topP) {
      this.topP = topP;
    }

    public Map<String, Model> getModels() {
      return models;
    }

    public void setModels(Map<String, Model> models) {
      this.models = models;
    }
  }

  public static class Model {

    private String displayName;

    /** Ratings on a 0..10 scale keyed by capability name (speed, knowledge, reasoning, ...). */
    private Map<String, Double> capabilities = new LinkedHashMap<>();

    @Valid private Pricing pricing = new Pricing();

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public Map<String, Double> getCapabilities() {
      return capabilities;
    }

    public void setCapabilities(Map<String, Double> capabilities) {
      this.capabilities = capabilities;
    }

    public Pricing getPricing() {
      return pricing;
    }

    public void setPricing(Pricing pricing) {
      this.pricing = pricing;
    }
  }

  public static class Pricing {

    @DecimalMin("0.0")
    private double inputPerToken;

    @DecimalMin("0.0")
    private double outputPerToken;

    public double getInputPerToken() {
      return inputPerToken;
    }

    public void setInputPerToken(double inputPerToken) {
      this.inputPerToken = inputPerToken;
    }

    public double getOutputPerToken() {
      return outputPerToken;
    }

    public void setOutputPerToken(double outputPerToken) {
      this.outputPerToken = outputPerToken;
    }
  }
}

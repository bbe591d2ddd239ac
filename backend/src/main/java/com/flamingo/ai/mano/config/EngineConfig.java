package com.flamingo.ai.mano.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Tunables of the context and memory engine. */
@Configuration
@ConfigurationProperties(prefix = "engine")
@Getter
@Setter
public class EngineConfig {

  private Cache cache = new Cache();
  private Aggregation aggregation = new Aggregation();
  private Search search = new Search();
  private Detection detection = new Detection();
  private Learning learning = new Learning();
  private Insights insights = new Insights();
  private Backfill backfill = new Backfill();

  @Getter
  @Setter
  public static class Cache {
    private Duration peopleTtl = Duration.ofMinutes(5);
    private Duration themesTtl = Duration.ofMinutes(3);
    private Duration challengesTtl = Duration.ofMinutes(3);
    private Duration patternsTtl = Duration.ofMinutes(4);
    private Duration semanticTtl = Duration.ofSeconds(30);

    /** Upper bound on cached entries across all users. */
    private long maximumSize = 10_000;
  }

  @Getter
  @Setter
  public static class Aggregation {
    private int themeWindowDays = 30;
    private int challengeWindowDays = 7;
    private int patternWindowDays = 14;
    private int personThemeWindowDays = 14;
    private int personThemeMessageLimit = 10;
    private int maxThemes = 5;
    private int maxThemeExamples = 3;
    private int maxPersonThemes = 3;
    private int mostDiscussedLimit = 5;
    private int trendingTopicLimit = 5;

    /** Per-branch deadline for the concurrent context fetches. */
    private Duration branchTimeout = Duration.ofSeconds(8);

    /** Deadline for the semantic search branch, which makes several model calls. */
    private Duration semanticTimeout = Duration.ofSeconds(20);
  }

  @Getter
  @Setter
  public static class Search {
    private int minQueryLength = 10;
    private double defaultThreshold = 0.78;
    private int defaultLimit = 10;
    private double personThreshold = 0.70;
    private int personLimit = 20;
    private double crossPersonThreshold = 0.75;
    private int crossPersonLimit = 30;
    private boolean queryExpansionEnabled = true;
    private boolean aiRerankingEnabled = true;
    private int connectedTopResults = 5;
    private int adjacentDays = 3;
    private int connectedLimit = 5;
    private int patternMinResults = 3;
    private int patternSnippetLimit = 8;
    private int patternSupportLimit = 5;
    private int resultLimit = 10;
    private int contextLimit = 5;
  }

  @Getter
  @Setter
  public static class Detection {
    private double confidenceFloor = 0.6;
    private double contextBonus = 0.1;
    private boolean aiValidationEnabled = true;
    private int aiMinScore = 6;
    private long validationCacheSize = 500;
    private Duration validationCacheTtl = Duration.ofMinutes(10);
  }

  @Getter
  @Setter
  public static class Learning {
    private int minHistorySize = 4;
    private double mergeThreshold = 0.6;
    private double confidenceIncrement = 0.1;
    private int minDescriptionLength = 5;
    private int minFrequencyForInsights = 2;
    private int insightPatternLimit = 10;
  }

  @Getter
  @Setter
  public static class Insights {
    private int inactivityDays = 7;
    private int starterLimit = 3;
    private int followUpDays = 3;
    private int followUpScanLimit = 20;
    private int followUpLimit = 3;
    private int patternAlertLimit = 3;
    private double patternAlertMinRelevance = 0.7;
    private int minTeamSizeForTeamInsights = 2;
    private int maxInsights = 10;
    private Duration insightLifetime = Duration.ofDays(7);
  }

  @Getter
  @Setter
  public static class Backfill {
    private int batchSize = 5;
    private Duration batchDelay = Duration.ofSeconds(1);
    private int maxMessagesPerRun = 50;
  }
}

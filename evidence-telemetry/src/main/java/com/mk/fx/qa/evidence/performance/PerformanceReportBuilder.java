package com.mk.fx.qa.evidence.performance;

import com.mk.fx.qa.evidence.analytics.Anomaly;
import com.mk.fx.qa.evidence.analytics.MetricTrend;
import com.mk.fx.qa.evidence.analytics.SeriesStats;
import com.mk.fx.qa.evidence.analytics.Statistics;
import com.mk.fx.qa.evidence.analytics.TrendMath;
import com.mk.fx.qa.evidence.dto.Filmstrip;
import com.mk.fx.qa.evidence.dto.PerformanceAnalysis;
import com.mk.fx.qa.evidence.dto.PerformanceReport;
import com.mk.fx.qa.evidence.dto.ResourceWaterfall;
import com.mk.fx.qa.evidence.utils.EvidenceUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

final class PerformanceReportBuilder {

  /** LCP jump between consecutive captures reported as an anomaly. */
  static final double LCP_SPIKE_MS = 1000;

  private final PerformanceScorer scorer;

  PerformanceReportBuilder(PerformanceScorer scorer) {
    this.scorer = scorer;
  }

  PerformanceReport build(String executionId, Collection<ScenarioPerformance> scenarios) {
    var r = new PerformanceReport();
    r.executionId = executionId;
    r.timestamp = Instant.now();

    List<PerformanceReport.ScenarioReport> reports = new ArrayList<>();
    for (ScenarioPerformance s : scenarios) {
      if (s.hasCaptures()) {
        reports.add(scenarioReport(s));
      }
    }
    r.scenarios = reports;

    var summary = new PerformanceReport.Summary();
    summary.totalScenarios = reports.size();
    summary.overallScore =
        reports.stream().mapToDouble(x -> x.summary.score()).average().orElse(0);
    summary.grade = PerformanceScorer.grade(summary.overallScore);
    summary.passedBudget =
        (int) reports.stream().filter(x -> x.summary.violations().isEmpty()).count();
    summary.failedBudget = reports.size() - summary.passedBudget;
    summary.topViolations =
        topByCount(reports, x -> x.summary.violations(), 5).stream()
            .map(e -> e.getKey() + " (" + e.getValue() + " scenarios)")
            .toList();
    summary.recommendations =
        topByCount(reports, x -> x.summary.recommendations(), 10).stream()
            .map(Map.Entry::getKey)
            .toList();
    r.summary = summary;
    r.benchmarks = benchmarks();
    return r;
  }

  PerformanceAnalysis analysis(String executionId, Collection<ScenarioPerformance> scenarios) {
    List<NavigationTiming> navigations = new ArrayList<>();
    List<CoreWebVitals> vitals = new ArrayList<>();
    List<LongTask> longTasks = new ArrayList<>();
    List<ResourceTiming> resources = new ArrayList<>();
    Map<ResourceTiming, String> pageHosts = new IdentityHashMap<>();
    for (ScenarioPerformance s : scenarios) {
      navigations.addAll(s.navigations.snapshot());
      vitals.addAll(s.vitals.snapshot());
      longTasks.addAll(s.longTasks.snapshot());
      String host = EvidenceUtils.hostOf(s.url());
      for (ResourceTiming res : s.resources.snapshot()) {
        resources.add(res);
        pageHosts.put(res, host);
      }
    }

    var a = new PerformanceAnalysis();
    a.executionId = executionId;
    a.timestamp = Instant.now();

    // network
    var net = new PerformanceAnalysis.Network();
    net.dns =
        phase(
            navigations,
            NavigationTiming::dns,
            50,
            "Consider DNS prefetching for critical domains");
    net.tcp =
        phase(
            navigations,
            NavigationTiming::tcp,
            100,
            "Consider using HTTP/2 or HTTP/3 for connection reuse");
    net.sslOverhead =
        navigations.stream().mapToDouble(NavigationTiming::ssl).filter(x -> x > 0).average().orElse(0);
    var ttfb = new PerformanceAnalysis.Ttfb();
    ttfb.average = navigations.stream().mapToDouble(NavigationTiming::ttfb).average().orElse(0);
    ttfb.redirect =
        navigations.stream().mapToDouble(n -> n.redirectCount() * 100.0).average().orElse(0);
    ttfb.serverProcessing =
        navigations.stream().mapToDouble(n -> n.ttfb() - n.tcp() - n.dns()).average().orElse(0);
    net.ttfb = ttfb;
    a.network = net;

    // rendering
    var rendering = new PerformanceAnalysis.Rendering();
    rendering.fcp = vitalStats(vitals, CoreWebVitals::fcp, false);
    rendering.lcp = vitalStats(vitals, CoreWebVitals::lcp, false);
    rendering.cls = vitalStats(vitals, CoreWebVitals::cls, false);
    a.rendering = rendering;

    // interactivity
    var inter = new PerformanceAnalysis.Interactivity();
    inter.fid = vitalStats(vitals, CoreWebVitals::fid, true);
    inter.inp = vitalStats(vitals, CoreWebVitals::inp, true);
    inter.tbt = vitalStats(vitals, CoreWebVitals::tbt, true);
    inter.longTaskCount = longTasks.size();
    inter.longTaskTotalDuration = longTasks.stream().mapToDouble(LongTask::duration).sum();
    a.interactivity = inter;

    // resource optimisation
    List<PerformanceAnalysis.Opportunity> opportunities = new ArrayList<>();
    List<ResourceTiming> uncompressed =
        resources.stream()
            .filter(x -> x.encodedBodySize() == x.decodedBodySize() && x.decodedBodySize() > 1000)
            .toList();
    if (!uncompressed.isEmpty()) {
      opportunities.add(
          new PerformanceAnalysis.Opportunity(
              "compression",
              "high",
              uncompressed.size(),
              uncompressed.stream().mapToDouble(x -> x.decodedBodySize() * 0.7).sum()));
    }
    List<ResourceTiming> uncached = resources.stream().filter(x -> !x.cached()).toList();
    if (uncached.size() > resources.size() * 0.3) {
      opportunities.add(
          new PerformanceAnalysis.Opportunity(
              "caching",
              "high",
              uncached.size(),
              uncached.stream().mapToDouble(ResourceTiming::duration).sum()));
    }
    var optimisation = new PerformanceAnalysis.ResourceOptimization();
    optimisation.opportunities = opportunities;
    a.resourceOptimization = optimisation;

    // third parties
    List<ResourceTiming> thirdParty =
        resources.stream()
            .filter(
                x -> {
                  String pageHost = pageHosts.get(x);
                  return pageHost != null && PerformanceScorer.isThirdParty(x.name(), pageHost);
                })
            .toList();
    var impact = new PerformanceAnalysis.ThirdPartyImpact();
    impact.count = thirdParty.size();
    impact.totalSize = thirdParty.stream().mapToLong(ResourceTiming::transferSize).sum();
    impact.totalDuration = thirdParty.stream().mapToDouble(ResourceTiming::duration).sum();
    impact.percentage = resources.isEmpty() ? 0 : (double) thirdParty.size() / resources.size() * 100.0;
    Map<String, PerformanceAnalysis.DomainUsage> byDomain = new TreeMap<>();
    for (ResourceTiming res : thirdParty) {
      String host = EvidenceUtils.hostOf(res.name());
      byDomain.merge(
          host,
          new PerformanceAnalysis.DomainUsage(1, res.transferSize(), res.duration()),
          (x, y) ->
              new PerformanceAnalysis.DomainUsage(
                  x.count() + y.count(), x.size() + y.size(), x.duration() + y.duration()));
    }
    impact.byDomain = byDomain;
    a.thirdPartyImpact = impact;
    return a;
  }

  List<ResourceWaterfall> waterfall(Collection<ScenarioPerformance> scenarios) {
    List<ResourceWaterfall> out = new ArrayList<>();
    for (ScenarioPerformance s : scenarios) {
      Optional<NavigationTiming> first = s.firstNavigation();
      if (first.isEmpty()) continue;
      NavigationTiming nav = first.get();
      List<ResourceWaterfall.Entry> entries = new ArrayList<>();

      Map<String, ResourceWaterfall.Phase> navPhases = new LinkedHashMap<>();
      navPhases.put("dns", phase(nav.domainLookupStart(), nav.domainLookupEnd()));
      navPhases.put("tcp", phase(nav.connectStart(), nav.connectEnd()));
      if (nav.secureConnectionStart() > 0) {
        navPhases.put("ssl", phase(nav.secureConnectionStart(), nav.connectEnd()));
      }
      navPhases.put("request", phase(nav.requestStart(), nav.responseStart()));
      navPhases.put("response", phase(nav.responseStart(), nav.responseEnd()));
      navPhases.put("dom", phase(nav.domInteractive(), nav.domComplete()));
      navPhases.put("load", phase(nav.loadEventStart(), nav.loadEventEnd()));
      entries.add(
          new ResourceWaterfall.Entry(
              "Navigation", "navigation", 0, nav.total(), nav.transferSize(), false, navPhases));

      for (ResourceTiming res : s.resources.snapshot()) {
        Map<String, ResourceWaterfall.Phase> phases = new LinkedHashMap<>();
        if (res.domainLookupEnd() - res.domainLookupStart() > 0) {
          phases.put("dns", phase(res.domainLookupStart(), res.domainLookupEnd()));
        }
        if (res.connectEnd() - res.connectStart() > 0) {
          phases.put("tcp", phase(res.connectStart(), res.connectEnd()));
        }
        if (res.secureConnectionStart() > 0) {
          phases.put("ssl", phase(res.secureConnectionStart(), res.connectEnd()));
        }
        phases.put("request", phase(res.requestStart(), res.responseStart()));
        phases.put("response", phase(res.responseStart(), res.responseEnd()));
        entries.add(
            new ResourceWaterfall.Entry(
                res.name(),
                res.initiatorType(),
                res.startTime(),
                res.duration(),
                res.transferSize(),
                res.cached(),
                phases));
      }
      entries.sort(Comparator.comparingDouble(ResourceWaterfall.Entry::startTime));
      out.add(new ResourceWaterfall(s.scenarioId, nav.fetchStart(), entries));
    }
    return out;
  }

  /** Empty when no scenario captured any frames. */
  Optional<Filmstrip> filmstrip(String executionId, Collection<ScenarioPerformance> scenarios) {
    List<Filmstrip.ScenarioFilmstrip> strips = new ArrayList<>();
    for (ScenarioPerformance s : scenarios) {
      if (s.frames().isEmpty()) continue;
      double speedIndex =
          s.latestVitals().map(v -> v.speedIndex().orElse(0)).orElse(0.0);
      strips.add(FilmstripBuilder.build(s.scenarioId, s.url(), s.frames(), speedIndex));
    }
    if (strips.isEmpty()) return Optional.empty();
    return Optional.of(new Filmstrip(executionId, Instant.now(), strips));
  }

  private PerformanceReport.ScenarioReport scenarioReport(ScenarioPerformance s) {
    var out = new PerformanceReport.ScenarioReport();
    out.scenarioId = s.scenarioId;
    List<NavigationTiming> navigations = s.navigations.snapshot();
    out.executions = (int) s.vitals.written();
    out.navigation = navigations.isEmpty() ? null : navigationStats(navigations);
    out.resources = resourceAnalysis(s.resources.snapshot());

    List<CoreWebVitals> vitals = s.vitals.snapshot();
    Map<String, SeriesStats> webVitals = new LinkedHashMap<>();
    webVitals.put("FCP", vitalStats(vitals, CoreWebVitals::fcp, false));
    webVitals.put("LCP", vitalStats(vitals, CoreWebVitals::lcp, false));
    webVitals.put("FID", vitalStats(vitals, CoreWebVitals::fid, true));
    webVitals.put("CLS", vitalStats(vitals, CoreWebVitals::cls, false));
    webVitals.put("TTFB", vitalStats(vitals, CoreWebVitals::ttfb, false));
    webVitals.put("TTI", vitalStats(vitals, CoreWebVitals::tti, true));
    webVitals.put("TBT", vitalStats(vitals, CoreWebVitals::tbt, true));
    webVitals.put("INP", vitalStats(vitals, CoreWebVitals::inp, true));
    out.webVitals = webVitals;

    out.longTasks = longTaskAnalysis(s.longTasks.snapshot());
    out.memory = memoryAnalysis(s.memory.snapshot());
    out.summary = s.summarise(scorer);

    Map<String, MetricTrend> trends = new LinkedHashMap<>();
    for (var e :
        Map.<String, Function<CoreWebVitals, VitalReading>>of(
                "LCP", CoreWebVitals::lcp,
                "FCP", CoreWebVitals::fcp,
                "TTFB", CoreWebVitals::ttfb,
                "TBT", CoreWebVitals::tbt)
            .entrySet()) {
      TrendMath.trend(e.getKey(), available(vitals, e.getValue())).ifPresent(t -> trends.put(e.getKey(), t));
    }
    out.trends = new TreeMap<>(trends);

    List<CoreWebVitals> withLcp = vitals.stream().filter(v -> v.lcp().isAvailable()).toList();
    double[] lcp = withLcp.stream().mapToDouble(v -> v.lcp().value()).toArray();
    List<Anomaly> anomalies = new ArrayList<>();
    for (int i : TrendMath.spikeIndexes(lcp, LCP_SPIKE_MS)) {
      anomalies.add(
          new Anomaly(
              "lcp_spike",
              s.scenarioId,
              withLcp.get(i).timestamp(),
              lcp[i],
              lcp[i - 1],
              lcp[i] - lcp[i - 1]));
    }
    out.anomalies = anomalies;

    List<CoreWebVitals> paired =
        vitals.stream().filter(v -> v.lcp().isAvailable() && v.ttfb().isAvailable()).toList();
    out.correlations =
        Map.of(
            "lcpTtfb",
            TrendMath.pearson(
                paired.stream().mapToDouble(v -> v.lcp().value()).toArray(),
                paired.stream().mapToDouble(v -> v.ttfb().value()).toArray()));
    return out;
  }

  private static Map<String, SeriesStats> navigationStats(List<NavigationTiming> navigations) {
    Map<String, ToDoubleFunction<NavigationTiming>> phases = new LinkedHashMap<>();
    phases.put("dns", NavigationTiming::dns);
    phases.put("tcp", NavigationTiming::tcp);
    phases.put("ssl", NavigationTiming::ssl);
    phases.put("ttfb", NavigationTiming::ttfb);
    phases.put("transfer", NavigationTiming::transfer);
    phases.put("domProcessing", NavigationTiming::domProcessing);
    phases.put("onLoad", NavigationTiming::onLoad);
    phases.put("total", NavigationTiming::total);
    Map<String, SeriesStats> out = new LinkedHashMap<>();
    phases.forEach(
        (name, fn) -> out.put(name, Statistics.summarise(navigations.stream().mapToDouble(fn).toArray())));
    return out;
  }

  private static PerformanceReport.ResourceAnalysis resourceAnalysis(List<ResourceTiming> resources) {
    var out = new PerformanceReport.ResourceAnalysis();
    out.total = resources.size();
    Map<String, ResourceGroup> byType = new TreeMap<>();
    for (ResourceTiming r : resources) {
      byType.merge(
          r.initiatorType() == null ? "other" : r.initiatorType(),
          ResourceGroup.EMPTY.plus(r),
          (a, b) -> a.plus(r));
    }
    out.byType = byType;
    out.slowest =
        resources.stream()
            .sorted(Comparator.comparingDouble(ResourceTiming::duration).reversed())
            .limit(10)
            .map(PerformanceReportBuilder::entry)
            .toList();
    out.largest =
        resources.stream()
            .sorted(Comparator.comparingLong(ResourceTiming::transferSize).reversed())
            .limit(10)
            .map(PerformanceReportBuilder::entry)
            .toList();
    out.cacheHitRate =
        resources.isEmpty()
            ? 0
            : (double) resources.stream().filter(ResourceTiming::cached).count()
                / resources.size()
                * 100.0;
    out.totalTransferSize = resources.stream().mapToLong(ResourceTiming::transferSize).sum();
    out.totalDuration = resources.stream().mapToDouble(ResourceTiming::duration).sum();
    return out;
  }

  private static PerformanceReport.LongTaskAnalysis longTaskAnalysis(List<LongTask> tasks) {
    if (tasks.isEmpty()) return null;
    var out = new PerformanceReport.LongTaskAnalysis();
    double[] durations = tasks.stream().mapToDouble(LongTask::duration).toArray();
    out.count = tasks.size();
    out.totalDuration = Arrays.stream(durations).sum();
    out.duration = Statistics.summarise(durations);
    out.worstTasks =
        tasks.stream()
            .sorted(Comparator.comparingDouble(LongTask::duration).reversed())
            .limit(5)
            .toList();
    return out;
  }

  private static PerformanceReport.MemoryAnalysis memoryAnalysis(List<BrowserMemory> snapshots) {
    if (snapshots.isEmpty()) return null;
    BrowserMemory first = snapshots.get(0);
    BrowserMemory last = snapshots.get(snapshots.size() - 1);
    var out = new PerformanceReport.MemoryAnalysis();
    out.initial =
        new PerformanceReport.HeapState(
            first.usedJsHeapSize(), first.totalJsHeapSize(), first.jsHeapSizeLimit());
    out.last =
        new PerformanceReport.HeapState(
            last.usedJsHeapSize(), last.totalJsHeapSize(), last.jsHeapSizeLimit());
    out.growthAbsolute = last.usedJsHeapSize() - first.usedJsHeapSize();
    out.growthPercentage =
        first.usedJsHeapSize() > 0 ? (double) out.growthAbsolute / first.usedJsHeapSize() * 100.0 : 0;
    out.peak = snapshots.stream().mapToLong(BrowserMemory::usedJsHeapSize).max().orElse(0);
    out.average = snapshots.stream().mapToLong(BrowserMemory::usedJsHeapSize).average().orElse(0);
    return out;
  }

  private static PerformanceReport.Benchmarks benchmarks() {
    var b = new PerformanceReport.Benchmarks();
    Map<String, PerformanceReport.Band> bands = new LinkedHashMap<>();
    bands.put("FCP", new PerformanceReport.Band(1800, 3000));
    bands.put("LCP", new PerformanceReport.Band(2500, 4000));
    bands.put("FID", new PerformanceReport.Band(100, 300));
    bands.put("CLS", new PerformanceReport.Band(0.1, 0.25));
    bands.put("TTFB", new PerformanceReport.Band(800, 1800));
    b.webVitals = bands;
    Map<String, PerformanceReport.Percentiles> industry = new LinkedHashMap<>();
    industry.put("FCP", new PerformanceReport.Percentiles(1500, 2500, 4000));
    industry.put("LCP", new PerformanceReport.Percentiles(2000, 3500, 5500));
    industry.put("FID", new PerformanceReport.Percentiles(50, 100, 200));
    industry.put("CLS", new PerformanceReport.Percentiles(0.05, 0.15, 0.3));
    b.industry = industry;
    return b;
  }

  private static PerformanceReport.ResourceEntry entry(ResourceTiming r) {
    return new PerformanceReport.ResourceEntry(
        r.name(), r.duration(), r.transferSize(), r.initiatorType());
  }

  private static PerformanceAnalysis.Phase phase(
      List<NavigationTiming> navigations,
      ToDoubleFunction<NavigationTiming> fn,
      double limit,
      String recommendation) {
    var p = new PerformanceAnalysis.Phase();
    p.average = navigations.stream().mapToDouble(fn).average().orElse(0);
    p.recommendations =
        navigations.stream().anyMatch(n -> fn.applyAsDouble(n) > limit)
            ? List.of(recommendation)
            : List.of();
    return p;
  }

  private static ResourceWaterfall.Phase phase(double start, double end) {
    return new ResourceWaterfall.Phase(start, end);
  }

  /** Stats over available readings; {@code positiveOnly} drops zero readings. */
  private static SeriesStats vitalStats(
      List<CoreWebVitals> vitals, Function<CoreWebVitals, VitalReading> fn, boolean positiveOnly) {
    double[] values = available(vitals, fn);
    if (positiveOnly) {
      values = Arrays.stream(values).filter(v -> v > 0).toArray();
    }
    return Statistics.summarise(values);
  }

  private static double[] available(
      List<CoreWebVitals> vitals, Function<CoreWebVitals, VitalReading> fn) {
    return vitals.stream()
        .map(fn)
        .map(VitalReading::asOptional)
        .filter(OptionalDouble::isPresent)
        .mapToDouble(OptionalDouble::getAsDouble)
        .toArray();
  }

  private static <T> List<Map.Entry<String, Long>> topByCount(
      List<T> items, Function<T, List<String>> values, int limit) {
    Map<String, Long> counts =
        items.stream()
            .flatMap(x -> values.apply(x).stream())
            .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
    return counts.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
        .limit(limit)
        .toList();
  }
}

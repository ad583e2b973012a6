package cn.bafuka.metricsieve.dataplane;

import cn.bafuka.metricsieve.core.Sample;
import cn.bafuka.metricsieve.core.SieveStats;
import cn.bafuka.metricsieve.dataplane.impl.CaffeineSampleHistory;
import cn.bafuka.metricsieve.dataplane.impl.FrequencySampleSieve;
import cn.bafuka.metricsieve.dataplane.rule.SiftRule;
import cn.bafuka.metricsieve.exception.SieveConfigException;
import cn.bafuka.metricsieve.model.SieveRule;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Random;

import static org.junit.Assert.*;

/**
 * FrequencySampleSieve 单元测试
 */
public class FrequencySampleSieveTest {

    private static final Instant T0 = Instant.ofEpochSecond(1_700_000_000L);

    private final List<CaffeineSampleHistory> histories = new ArrayList<>();

    private FrequencySampleSieve sieve;

    private CaffeineSampleHistory history;

    @Before
    public void setUp() {
        sieve = newSieve(SieveRule.ReportConfig.builder()
                .minPointAccumulationTime(Duration.ZERO)
                .constantMetricsReportFrequency(Duration.ofSeconds(30))
                .lowInfoMetricsReportFrequency(Duration.ofMinutes(2))
                .maxReportFrequency(Duration.ofMinutes(5))
                .build());
        history = histories.get(0);
    }

    @After
    public void tearDown() {
        for (CaffeineSampleHistory history : histories) {
            history.shutdown();
        }
    }

    /**
     * 测试首个采样点总是转发
     */
    @Test
    public void testFirstSampleKept() {
        assertFalse(sieve.sift("cpu.idle", Sample.of(T0, 42.0)));
        assertEquals(T0, sieve.getLastForwarded("cpu.idle"));
    }

    /**
     * 测试 NaN 直接放行，且不影响历史和转发时间
     */
    @Test
    public void testNaNKeptWithoutSideEffects() {
        assertFalse(sieve.sift("cpu.idle", Sample.of(T0, Double.NaN)));

        assertNull("NaN must not mark the metric as forwarded", sieve.getLastForwarded("cpu.idle"));

        // NaN 之后的第一个正常值仍然走首次观测
        assertFalse(sieve.sift("cpu.idle", Sample.of(T0.plusSeconds(1), 1.0)));
        assertEquals(T0.plusSeconds(1), sieve.getLastForwarded("cpu.idle"));

        SieveStats stats = sieve.getStats();
        assertEquals(1, stats.getNanCount());
        assertEquals(2, stats.getKeptCount());
        assertEquals(1L, (long) stats.getDecisions().get(SiftRule.BOOTSTRAP));
        assertEquals(1L, (long) stats.getDecisions().get(SiftRule.NAN_PASS_THROUGH));
    }

    /**
     * 测试 NaN 不写入空历史
     */
    @Test
    public void testNaNNotRegisteredInEmptyHistory() {
        assertFalse(sieve.sift("cpu.idle", Sample.of(T0, Double.NaN)));

        assertTrue(history.list("cpu.idle").isEmpty());
        assertEquals(0, history.size());
    }

    /**
     * 测试 NaN 不改动已有历史，包括同一时间戳上的值
     */
    @Test
    public void testNaNNotRegisteredInExistingHistory() {
        assertFalse(sieve.sift("cpu.idle", Sample.of(T0, 1.0)));

        assertFalse(sieve.sift("cpu.idle", Sample.of(T0.plusSeconds(10), Double.NaN)));
        assertFalse(sieve.sift("cpu.idle", Sample.of(T0, Double.NaN)));

        NavigableMap<Instant, Double> stored = history.list("cpu.idle");
        assertEquals(1, stored.size());
        assertEquals(1.0, stored.get(T0), 0.0);
        assertEquals(T0, sieve.getLastForwarded("cpu.idle"));
    }

    /**
     * 测试预热期内任意值都转发
     */
    @Test
    public void testWarmUpKeepsEverything() {
        FrequencySampleSieve warming = newSieve(SieveRule.ReportConfig.builder()
                .minPointAccumulationTime(Duration.ofMinutes(15))
                .constantMetricsReportFrequency(Duration.ofMinutes(5))
                .lowInfoMetricsReportFrequency(Duration.ofMinutes(2))
                .maxReportFrequency(Duration.ofSeconds(30))
                .build());

        for (int minute = 0; minute < 15; minute++) {
            assertFalse("Sample at minute " + minute + " should be kept during warm-up",
                    warming.sift("disk.used", Sample.of(T0.plus(Duration.ofMinutes(minute)), 0.0)));
        }

        // 预热结束后常量指标被丢弃
        assertTrue(warming.sift("disk.used", Sample.of(T0.plus(Duration.ofMinutes(15)), 0.0)));
        assertEquals(T0.plus(Duration.ofMinutes(14)), warming.getLastForwarded("disk.used"));
    }

    /**
     * 测试迟到的采样点把窗口起点前移，重新进入预热
     */
    @Test
    public void testLateSampleInsideWarmUpWindow() {
        FrequencySampleSieve warming = newSieve(SieveRule.ReportConfig.builder()
                .minPointAccumulationTime(Duration.ofMinutes(15))
                .constantMetricsReportFrequency(Duration.ofMinutes(5))
                .build());

        assertFalse(warming.sift("m", Sample.of(T0.plus(Duration.ofMinutes(20)), 1.0)));
        assertFalse(warming.sift("m", Sample.of(T0, 1.0)));
        assertEquals(T0, warming.getLastForwarded("m"));
    }

    /**
     * 测试常量指标按心跳频率转发
     */
    @Test
    public void testConstantMetricHeartbeat() {
        boolean[] expected = {false, true, true, false, true, true, false};
        for (int i = 0; i < expected.length; i++) {
            Instant timestamp = T0.plusSeconds(10L * i);
            assertEquals("Unexpected decision at +" + (10 * i) + "s",
                    expected[i], sieve.sift("disk.used", Sample.of(timestamp, 0.0)));
        }

        SieveStats stats = sieve.getStats();
        assertEquals(3, stats.getKeptCount());
        assertEquals(4, stats.getDroppedCount());
        assertEquals(2L, (long) stats.getDecisions().get(SiftRule.CONSTANT_HEARTBEAT));
        assertEquals(4L, (long) stats.getDecisions().get(SiftRule.CONSTANT));
    }

    /**
     * 测试分钟级常量指标每次都超过心跳间隔
     */
    @Test
    public void testConstantMetricSampledPerMinute() {
        for (int minute = 0; minute < 5; minute++) {
            assertFalse(sieve.sift("disk.used", Sample.of(T0.plus(Duration.ofMinutes(minute)), 0.0)));
        }
    }

    /**
     * 测试线性变化的指标被当作低信息量丢弃，振荡指标按最低频率转发
     */
    @Test
    public void testLowInformationVersusOscillation() {
        FrequencySampleSieve tight = newSieve(SieveRule.ReportConfig.builder()
                .minPointAccumulationTime(Duration.ZERO)
                .constantMetricsReportFrequency(Duration.ofMinutes(5))
                .lowInfoMetricsReportFrequency(Duration.ofMinutes(2))
                .maxReportFrequency(Duration.ofSeconds(2))
                .build());

        double[] ramp = {0.0, 1.0, 2.0, 3.0, 4.0};
        double[] oscillating = {0.0, 4.0, 1.0, 3.0, 2.0};
        boolean[] rampDrops = new boolean[ramp.length];
        boolean[] oscillatingDrops = new boolean[oscillating.length];
        for (int i = 0; i < ramp.length; i++) {
            rampDrops[i] = tight.sift("ramp", Sample.of(T0.plusSeconds(i), ramp[i]));
            oscillatingDrops[i] = tight.sift("oscillating", Sample.of(T0.plusSeconds(i), oscillating[i]));
        }

        assertArrayEquals(new boolean[]{false, true, true, true, true}, rampDrops);
        assertArrayEquals(new boolean[]{false, true, true, true, false}, oscillatingDrops);
        assertEquals(T0.plusSeconds(4), tight.getLastForwarded("oscillating"));
        assertEquals(T0, tight.getLastForwarded("ramp"));
    }

    /**
     * 测试 10 秒采集的 cpu.idle 场景
     */
    @Test
    public void testCpuIdleScenario() {
        double[] values = {90.0, 90.5, 89.5, 90.0, 90.0};
        boolean[] drops = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            drops[i] = sieve.sift("cpu.idle", Sample.of(T0.plusSeconds(10L * i), values[i]));
        }

        assertArrayEquals(new boolean[]{false, true, true, false, true}, drops);

        SieveStats stats = sieve.getStats();
        assertEquals(1L, (long) stats.getDecisions().get(SiftRule.BOOTSTRAP));
        assertEquals(2L, (long) stats.getDecisions().get(SiftRule.LOW_INFO));
        assertEquals(1L, (long) stats.getDecisions().get(SiftRule.CONSTANT_HEARTBEAT));
        assertEquals(1L, (long) stats.getDecisions().get(SiftRule.FALLBACK));
        assertEquals(0.4, stats.keepRate(), 1e-9);
    }

    /**
     * 测试分钟级 cpu.idle 每个点都超过 30 秒心跳，全部转发
     */
    @Test
    public void testCpuIdlePerMinuteAllKept() {
        double[] values = {90.0, 90.1, 89.9, 90.0, 90.0};
        for (int i = 0; i < values.length; i++) {
            assertFalse(sieve.sift("cpu.idle", Sample.of(T0.plus(Duration.ofMinutes(i)), values[i])));
        }

        SieveStats stats = sieve.getStats();
        assertEquals(4L, (long) stats.getDecisions().get(SiftRule.CONSTANT_HEARTBEAT));
        assertEquals(0, stats.getDroppedCount());
    }

    /**
     * 测试相同输入重放得到相同结果
     */
    @Test
    public void testReplayIsDeterministic() {
        SieveRule.ReportConfig config = SieveRule.ReportConfig.builder()
                .minPointAccumulationTime(Duration.ofSeconds(20))
                .constantMetricsReportFrequency(Duration.ofSeconds(40))
                .lowInfoMetricsReportFrequency(Duration.ofSeconds(25))
                .maxReportFrequency(Duration.ofSeconds(15))
                .build();
        List<String> identities = new ArrayList<>();
        List<Sample> samples = new ArrayList<>();
        Random random = new Random(42);
        for (int i = 0; i < 300; i++) {
            identities.add("m" + random.nextInt(3));
            // 偶尔出现乱序与重复时间戳
            long offset = i - random.nextInt(3);
            double value = random.nextInt(5) == 0 ? Double.NaN : random.nextInt(4);
            samples.add(Sample.of(T0.plusSeconds(offset), value));
        }

        FrequencySampleSieve first = newSieve(config);
        FrequencySampleSieve second = newSieve(config);
        for (int i = 0; i < samples.size(); i++) {
            assertEquals("Replay diverged at index " + i,
                    first.sift(identities.get(i), samples.get(i)),
                    second.sift(identities.get(i), samples.get(i)));
        }
        assertEquals(first.getStats(), second.getStats());
    }

    /**
     * 测试不同指标的状态相互隔离
     */
    @Test
    public void testMetricsAreIsolated() {
        assertFalse(sieve.sift("a", Sample.of(T0, 1.0)));
        assertFalse(sieve.sift("b", Sample.of(T0.plusSeconds(10), 1.0)));

        assertEquals(T0, sieve.getLastForwarded("a"));
        assertEquals(T0.plusSeconds(10), sieve.getLastForwarded("b"));
        assertNull(sieve.getLastForwarded("c"));
    }

    /**
     * 测试返回的配置是副本
     */
    @Test
    public void testConfigIsCopied() {
        SieveRule.ReportConfig config = sieve.getConfig();
        config.setMaxReportFrequency(Duration.ofHours(1));

        assertEquals(Duration.ofMinutes(5), sieve.getConfig().getMaxReportFrequency());
    }

    @Test
    public void testNegativeAccumulationRejected() {
        SieveRule.ReportConfig config = SieveRule.ReportConfig.builder()
                .minPointAccumulationTime(Duration.ofSeconds(-1))
                .build();

        try {
            newSieve(config);
            fail("Negative accumulation time should be rejected");
        } catch (SieveConfigException e) {
            assertEquals("report.minPointAccumulationTime", e.getField());
            assertEquals(SieveConfigException.Reason.NEGATIVE, e.getReason());
        }
    }

    @Test
    public void testZeroFrequencyRejected() {
        SieveRule.ReportConfig config = SieveRule.ReportConfig.builder()
                .lowInfoMetricsReportFrequency(Duration.ZERO)
                .build();

        try {
            newSieve(config);
            fail("Zero report frequency should be rejected");
        } catch (SieveConfigException e) {
            assertEquals("report.lowInfoMetricsReportFrequency", e.getField());
            assertEquals(SieveConfigException.Reason.NOT_POSITIVE, e.getReason());
        }
    }

    @Test
    public void testInvalidCoefficientRejected() {
        try {
            newSieve(SieveRule.ReportConfig.builder().iqrAnomalyCoefficient(Double.NaN).build());
            fail("NaN coefficient should be rejected");
        } catch (SieveConfigException e) {
            assertEquals(SieveConfigException.Reason.NOT_FINITE, e.getReason());
        }

        try {
            newSieve(SieveRule.ReportConfig.builder().variationIqrThresholdCoefficient(-1.0).build());
            fail("Negative coefficient should be rejected");
        } catch (SieveConfigException e) {
            assertEquals("report.variationIqrThresholdCoefficient", e.getField());
            assertEquals(SieveConfigException.Reason.NEGATIVE, e.getReason());
        }
    }

    @Test(expected = SieveConfigException.class)
    public void testMissingConfigRejected() {
        newSieve(null);
    }

    private FrequencySampleSieve newSieve(SieveRule.ReportConfig config) {
        CaffeineSampleHistory history = new CaffeineSampleHistory("test",
                new SieveRule.HistoryConfig(), new FakeTicker());
        histories.add(history);
        return new FrequencySampleSieve("test", config, history);
    }
}

package org.janelia.seaflow.stats;

import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.janelia.seaflow.evt.EvtChannel;
import org.janelia.seaflow.evt.EvtTestData;
import org.janelia.seaflow.evt.ParticleMatrix;
import org.janelia.seaflow.filter.FilterParams;
import org.janelia.seaflow.filter.FilteredResult;
import org.junit.Test;

public class StatsTransformTest {

    @Test
    public void transformRange() {
        MatcherAssert.assertThat(StatsTransform.transform(0), Matchers.equalTo(1.0));
        MatcherAssert.assertThat(StatsTransform.transform(65536), Matchers.closeTo(Math.pow(10, 3.5), 1e-9));
    }

    @Test
    public void transformIsMonotonic() {
        double previous = StatsTransform.transform(0);
        for (int v = 1; v <= 65535; v += 257) {
            double current = StatsTransform.transform(v);
            MatcherAssert.assertThat(current, Matchers.greaterThan(previous));
            previous = current;
        }
    }

    @Test
    public void computeContinuousChannels() {
        ParticleMatrix opp = EvtTestData.sampleParticles().selectRows(new int[] {0, 1, 2});
        ChannelStats stats = StatsTransform.compute(new FilteredResult(opp, 6, FilterParams.defaults()));

        MatcherAssert.assertThat(stats.asMap().keySet(), Matchers.containsInAnyOrder(EvtChannel.CONTINUOUS.toArray(new EvtChannel[0])));
        ChannelSummary fscSmall = stats.get(EvtChannel.FSC_SMALL).orElseThrow(AssertionError::new);
        MatcherAssert.assertThat(fscSmall, Matchers.equalTo(new ChannelSummary(10000, 30000, 20000)));
        ChannelSummary d2 = stats.get(EvtChannel.D2).orElseThrow(AssertionError::new);
        MatcherAssert.assertThat(d2.getMean(), Matchers.closeTo(6100. / 3, 1e-9));
        MatcherAssert.assertThat(stats.get(EvtChannel.TIME).isPresent(), Matchers.is(false));
    }

    @Test
    public void computeWithoutRetainedParticles() {
        ChannelStats stats = StatsTransform.compute(new FilteredResult(ParticleMatrix.empty(), 6, FilterParams.defaults()));
        MatcherAssert.assertThat(stats.isEmpty(), Matchers.is(true));
    }

    @Test
    public void transformStats() {
        ParticleMatrix opp = EvtTestData.sampleParticles().selectRows(new int[] {0, 1, 2});
        ChannelStats stats = StatsTransform.transform(StatsTransform.compute(new FilteredResult(opp, 6, FilterParams.defaults())));
        ChannelSummary fscSmall = stats.get(EvtChannel.FSC_SMALL).orElseThrow(AssertionError::new);
        MatcherAssert.assertThat(fscSmall.getMin(), Matchers.equalTo(StatsTransform.transform(10000)));
        MatcherAssert.assertThat(fscSmall.getMax(), Matchers.equalTo(StatsTransform.transform(30000)));
        MatcherAssert.assertThat(fscSmall.getMean(), Matchers.equalTo(StatsTransform.transform(20000)));
    }
}

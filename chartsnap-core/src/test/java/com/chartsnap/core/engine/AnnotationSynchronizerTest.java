package com.chartsnap.core.engine;

import com.chartsnap.core.host.HostException;
import com.chartsnap.core.host.InMemoryChartHost;
import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.LineStyle;
import com.chartsnap.core.model.Surface;
import com.chartsnap.core.model.Timeframe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AnnotationSynchronizer.
 */
class AnnotationSynchronizerTest {

    private InMemoryChartHost host;
    private AnnotationSynchronizer synchronizer;
    private Surface h1;
    private Surface m15;
    private Surface d1;

    @BeforeEach
    void setUp() {
        host = new InMemoryChartHost();
        synchronizer = new AnnotationSynchronizer(host);
        h1 = host.addSurface(42, "XAUUSDp", Timeframe.H1);
        m15 = host.addSurface(43, "XAUUSDp", Timeframe.M15);
        d1 = host.addSurface(44, "XAUUSDp", Timeframe.D1);
    }

    private List<HorizontalLine> mirrorsOn(Surface surface) throws HostException {
        return host.lines(surface.handle()).stream()
            .filter(l -> MirrorNames.isMirror(l.name()))
            .toList();
    }

    @Nested
    @DisplayName("Mirroring")
    class MirroringTests {

        @Test
        @DisplayName("Copies user lines from every other chart of the symbol")
        void copiesFromOtherCharts() throws Exception {
            // Given
            host.addUserLine(h1, HorizontalLine.of("R1", 2650.5, Color.RED));
            host.addUserLine(d1, HorizontalLine.of("S1", 2600.0, Color.GREEN));

            // When
            int copied = synchronizer.sync(m15);

            // Then
            assertEquals(2, copied);
            assertTrue(host.findLine(m15.handle(), "R1_copied_42").isPresent());
            assertTrue(host.findLine(m15.handle(), "S1_copied_44").isPresent());
        }

        @Test
        @DisplayName("Copies price, color, width, style and label, drawn in the background")
        void copiesAttributesVerbatim() throws Exception {
            // Given
            HorizontalLine source = new HorizontalLine("R1", 2650.5, new Color(0x1E, 0x90, 0xFF),
                3, LineStyle.DASH_DOT, "weekly high", false);
            host.addUserLine(h1, source);

            // When
            synchronizer.sync(m15);

            // Then
            HorizontalLine mirror = host.findLine(m15.handle(), "R1_copied_42").orElseThrow();
            assertEquals(2650.5, mirror.price());
            assertEquals(source.color(), mirror.color());
            assertEquals(3, mirror.width());
            assertEquals(LineStyle.DASH_DOT, mirror.style());
            assertEquals("weekly high", mirror.label());
            assertTrue(mirror.background(), "Mirror should be drawn in the background");
        }

        @Test
        @DisplayName("Does not mirror a chart's own lines onto itself")
        void skipsDestinationAsSource() throws Exception {
            // Given
            host.addUserLine(m15, HorizontalLine.of("own", 2610.0, Color.RED));

            // When
            int copied = synchronizer.sync(m15);

            // Then
            assertEquals(0, copied);
            assertEquals(1, host.lines(m15.handle()).size());
        }

        @Test
        @DisplayName("Ignores charts of other symbols")
        void ignoresOtherSymbols() throws Exception {
            // Given
            Surface eurusd = host.addSurface(50, "EURUSD", Timeframe.H1);
            host.addUserLine(eurusd, HorizontalLine.of("E1", 1.0850, Color.BLUE));

            // When
            int copied = synchronizer.sync(m15);

            // Then
            assertEquals(0, copied);
            assertTrue(mirrorsOn(m15).isEmpty());
        }

        @Test
        @DisplayName("Never modifies or deletes user-authored lines")
        void leavesUserLinesAlone() throws Exception {
            // Given
            HorizontalLine own = HorizontalLine.of("own", 2610.0, Color.RED);
            HorizontalLine source = HorizontalLine.of("R1", 2650.5, Color.RED);
            host.addUserLine(m15, own);
            host.addUserLine(h1, source);

            // When
            synchronizer.sync(m15);
            synchronizer.sync(h1);

            // Then
            assertEquals(Optional.of(own), host.findLine(m15.handle(), "own"));
            assertEquals(Optional.of(source), host.findLine(h1.handle(), "R1"));
        }
    }

    @Nested
    @DisplayName("Idempotence and bounds")
    class IdempotenceTests {

        @Test
        @DisplayName("Syncing twice without changes yields the same mirror set")
        void syncIsIdempotent() throws Exception {
            // Given
            host.addUserLine(h1, HorizontalLine.of("R1", 2650.5, Color.RED));
            host.addUserLine(d1, HorizontalLine.of("S1", 2600.0, Color.GREEN));

            // When
            synchronizer.sync(m15);
            List<HorizontalLine> first = mirrorsOn(m15);
            synchronizer.sync(m15);
            List<HorizontalLine> second = mirrorsOn(m15);

            // Then
            assertEquals(2, first.size());
            assertEquals(first.stream().sorted((a, b) -> a.name().compareTo(b.name())).toList(),
                second.stream().sorted((a, b) -> a.name().compareTo(b.name())).toList());
        }

        @Test
        @DisplayName("Mirrors are never mirrored again, across many cycles")
        void noTransitiveMirrors() throws Exception {
            // Given
            host.addUserLine(h1, HorizontalLine.of("R1", 2650.5, Color.RED));
            host.addUserLine(m15, HorizontalLine.of("M1", 2620.0, Color.ORANGE));
            host.addUserLine(d1, HorizontalLine.of("S1", 2600.0, Color.GREEN));

            // When
            for (int cycle = 0; cycle < 5; cycle++) {
                synchronizer.sync(h1);
                synchronizer.sync(m15);
                synchronizer.sync(d1);
            }

            // Then - each chart holds exactly one mirror per user line on the other two charts
            assertEquals(2, mirrorsOn(h1).size());
            assertEquals(2, mirrorsOn(m15).size());
            assertEquals(2, mirrorsOn(d1).size());
            for (HorizontalLine mirror : mirrorsOn(m15)) {
                assertEquals(1, mirror.name().split(MirrorNames.MIRROR_TAG, -1).length - 1,
                    "Mirror name should carry a single tag: " + mirror.name());
            }
        }
    }

    @Nested
    @DisplayName("Stale mirrors")
    class StaleMirrorTests {

        @Test
        @DisplayName("Removes the mirror of a deleted source line")
        void purgesMirrorOfDeletedSource() throws Exception {
            // Given
            host.addUserLine(h1, HorizontalLine.of("R1", 2650.5, Color.RED));
            synchronizer.sync(m15);
            assertTrue(host.findLine(m15.handle(), "R1_copied_42").isPresent());

            // When
            host.deleteLine(h1.handle(), "R1");
            synchronizer.sync(m15);

            // Then
            assertTrue(host.findLine(m15.handle(), "R1_copied_42").isEmpty());
            assertTrue(mirrorsOn(m15).isEmpty());
        }

        @Test
        @DisplayName("Removes mirrors whose source chart was closed")
        void purgesMirrorOfClosedChart() throws Exception {
            // Given
            host.addUserLine(d1, HorizontalLine.of("S1", 2600.0, Color.GREEN));
            synchronizer.sync(m15);

            // When
            host.close(d1.handle());
            synchronizer.sync(m15);

            // Then
            assertTrue(mirrorsOn(m15).isEmpty());
        }

        @Test
        @DisplayName("Refreshes an existing mirror to the source's new price")
        void refreshesMovedSource() throws Exception {
            // Given - a mirror left over from a prior cycle
            host.addUserLine(h1, HorizontalLine.of("X", 2700.0, Color.RED));
            host.addUserLine(m15, HorizontalLine.of("X_copied_42", 2650.0, Color.RED).withBackground(true));

            // When
            synchronizer.sync(m15);

            // Then
            List<HorizontalLine> named = host.lines(m15.handle()).stream()
                .filter(l -> l.name().equals("X_copied_42"))
                .toList();
            assertEquals(1, named.size());
            assertEquals(2700.0, named.get(0).price());
        }
    }

    @Test
    @DisplayName("purgeMirrors deletes only tagged lines")
    void purgeMirrorsOnlyTouchesMirrors() throws Exception {
        // Given
        host.addUserLine(m15, HorizontalLine.of("own", 2610.0, Color.RED));
        host.addUserLine(m15, HorizontalLine.of("R1_copied_42", 2650.0, Color.RED));
        host.addUserLine(m15, HorizontalLine.of("S1_copied_44", 2600.0, Color.RED));

        // When
        int deleted = synchronizer.purgeMirrors(m15);

        // Then
        assertEquals(2, deleted);
        assertEquals(List.of("own"), host.lines(m15.handle()).stream().map(HorizontalLine::name).toList());
    }
}

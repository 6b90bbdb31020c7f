package com.chartsnap.desk.workspace;

import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.LineStyle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Workspace YAML handling.
 */
class WorkspaceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Loads charts and lines from YAML with defaults for omitted fields")
    void loadsYaml() throws Exception {
        // Given
        Path file = tempDir.resolve("workspace.yaml");
        Files.writeString(file, String.join("\n",
            "charts:",
            "  - symbol: XAUUSDp",
            "    timeframe: H4",
            "    lines:",
            "      - name: Support",
            "        price: 2650.5",
            "        color: \"#00FF00\"",
            "        style: DOT",
            "      - name: Plain",
            "        price: 2600",
            "  - symbol: XAUUSDp",
            "    timeframe: M15",
            ""));

        // When
        Workspace workspace = Workspace.load(file);

        // Then
        assertEquals(2, workspace.getCharts().size());
        Workspace.ChartEntry h4 = workspace.getCharts().get(0);
        assertEquals("H4", h4.getTimeframe());
        HorizontalLine support = h4.getLines().get(0).toLine();
        assertEquals(2650.5, support.price());
        assertEquals(Color.GREEN, support.color());
        assertEquals(LineStyle.DOT, support.style());

        HorizontalLine plain = h4.getLines().get(1).toLine();
        assertEquals(Color.RED, plain.color());
        assertEquals(LineStyle.SOLID, plain.style());
        assertTrue(workspace.getCharts().get(1).getLines().isEmpty());
    }

    @Test
    @DisplayName("Unknown line styles fall back to solid")
    void unknownStyle() {
        Workspace.LineEntry entry = new Workspace.LineEntry("L", 1.0, "#000000");
        entry.setStyle("wiggly");

        assertEquals(LineStyle.SOLID, entry.toLine().style());
    }

    @Test
    @DisplayName("Saved workspace loads back")
    void saveAndLoad() throws Exception {
        Workspace workspace = new Workspace();
        Workspace.ChartEntry chart = new Workspace.ChartEntry("EURUSD", "H1");
        chart.getLines().add(new Workspace.LineEntry("Parity", 1.0, "#0000FF"));
        workspace.getCharts().add(chart);
        Path file = tempDir.resolve("nested/workspace.yaml");

        workspace.save(file);
        Workspace loaded = Workspace.load(file);

        assertEquals("EURUSD", loaded.getCharts().get(0).getSymbol());
        assertEquals("Parity", loaded.getCharts().get(0).getLines().get(0).getName());
    }
}

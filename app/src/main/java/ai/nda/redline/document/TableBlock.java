package ai.nda.redline.document;

import java.util.List;
import java.util.Objects;

public record TableBlock(List<Row> rows) implements Block {

    public TableBlock {
        rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    }

    public record Row(List<Cell> cells) {

        public Row {
            cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
        }
    }

    /**
     * A table cell; its blocks form an independent region, so no match ever crosses a cell boundary.
     */
    public record Cell(List<Block> blocks) {

        public Cell {
            blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
        }
    }
}

package io.github.yok.flexetl.transform;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexetl.table.Table;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one transformation: the resulting table, the number of rows, cells or columns the
 * operation affected, and the warnings it emitted.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class TransformResult {

    // Table produced by the transformation
    private final Table table;

    // Operation-specific count (rows removed, cells filled, columns converted, ...)
    private final int affected;

    // Soft failures and numeric-stability guards hit by the operation
    private final List<String> warnings;

    /**
     * Creates a result without warnings.
     *
     * @param table resulting table
     * @param affected affected count
     */
    public TransformResult(Table table, int affected) {
        this(table, affected, ImmutableList.of());
    }

    /**
     * Creates a result.
     *
     * @param table resulting table
     * @param affected affected count
     * @param warnings warnings in emission order
     */
    public TransformResult(Table table, int affected, List<String> warnings) {
        this.table = table;
        this.affected = affected;
        this.warnings = ImmutableList.copyOf(warnings);
    }
}

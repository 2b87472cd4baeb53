package org.carball.abacus.query;

import org.carball.abacus.config.ColumnRole;
import org.carball.abacus.config.LogicalTable;
import org.carball.abacus.config.SourceSettings;
import org.carball.abacus.dialect.SqlDialect;
import org.carball.abacus.model.definition.IdentifierType;
import org.carball.abacus.model.definition.MetricDefinition;

/**
 * Bridges the user id and anonymous id spaces through the identifies table.
 *
 * <p>The identifies table is always aliased {@value #IDENTIFY_ALIAS}; derived tables built on top of a
 * bridged source rely on that alias, so primary tables must never use it.
 */
public class IdentityReconciler {

    public static final String IDENTIFY_ALIAS = "i";

    /** Column every caller-supplied fragment exposes its identifier as. */
    public static final String FRAGMENT_ID_COLUMN = "user_id";

    private final SourceSettings settings;
    private final SqlDialect dialect;

    public IdentityReconciler(SourceSettings settings, SqlDialect dialect) {
        this.settings = settings;
        this.dialect = dialect;
    }

    /**
     * Reconciles a physical table whose identifier columns come from a settings section,
     * optionally overridden by a metric.
     */
    public IdentityColumn reconcile(IdentifierType requested, IdentifierType nativeType, String alias,
                                    LogicalTable section, MetricDefinition metric) {
        checkAlias(alias);
        if (requested == nativeType) {
            return IdentityColumn.direct(
                    alias + "." + settings.columnFor(section, ColumnRole.forIdentifier(requested), metric));
        }
        String nativeColumn = alias + "." + settings.columnFor(section, ColumnRole.forIdentifier(nativeType), metric);
        return bridge(requested, nativeType, nativeColumn);
    }

    /**
     * Reconciles a caller-supplied fragment exposing {@value #FRAGMENT_ID_COLUMN} in its native space.
     */
    public IdentityColumn reconcileFragment(IdentifierType requested, IdentifierType nativeType, String alias) {
        checkAlias(alias);
        String nativeColumn = alias + "." + FRAGMENT_ID_COLUMN;
        if (requested == nativeType) {
            return IdentityColumn.direct(nativeColumn);
        }
        return bridge(requested, nativeType, nativeColumn);
    }

    /**
     * Join clause mapping {@code nativeColumn} onto the identifies table.
     */
    public String identifiesJoin(String nativeColumn, IdentifierType nativeType) {
        String identifiesColumn = settings.columnFor(LogicalTable.IDENTIFIES, ColumnRole.forIdentifier(nativeType));
        return "JOIN " + dialect.qualifyTable(settings.table(LogicalTable.IDENTIFIES)) + " " + IDENTIFY_ALIAS + " ON (\n"
                + "  " + IDENTIFY_ALIAS + "." + identifiesColumn + " = " + nativeColumn + "\n"
                + ")";
    }

    private IdentityColumn bridge(IdentifierType requested, IdentifierType nativeType, String nativeColumn) {
        String requestedColumn = IDENTIFY_ALIAS + "."
                + settings.columnFor(LogicalTable.IDENTIFIES, ColumnRole.forIdentifier(requested));
        return new IdentityColumn(requestedColumn, identifiesJoin(nativeColumn, nativeType));
    }

    private static void checkAlias(String alias) {
        if (IDENTIFY_ALIAS.equals(alias)) {
            throw new IllegalArgumentException("Alias '" + IDENTIFY_ALIAS + "' is reserved for the identifies table");
        }
    }
}

package org.carball.router.parser;

import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.WithItem;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the plain SELECT blocks of a statement: the top level, set
 * operation branches, CTEs and derived tables in FROM / JOIN.
 */
public final class SelectWalker {

    private SelectWalker() {
        // Utility class - prevent instantiation
    }

    public static List<PlainSelect> plainSelects(Statement statement) {
        List<PlainSelect> result = new ArrayList<>();
        if (statement instanceof Select select) {
            collect(select, result);
        }
        return result;
    }

    public static List<String> tableNames(Statement statement) {
        Set<String> names = new LinkedHashSet<>();
        for (PlainSelect plainSelect : plainSelects(statement)) {
            addTable(plainSelect.getFromItem(), names);
            if (plainSelect.getJoins() != null) {
                for (Join join : plainSelect.getJoins()) {
                    addTable(join.getRightItem(), names);
                }
            }
        }
        return new ArrayList<>(names);
    }

    private static void collect(Select select, List<PlainSelect> result) {
        if (select.getWithItemsList() != null) {
            for (WithItem withItem : select.getWithItemsList()) {
                if (withItem.getSelect() != null) {
                    collect(withItem.getSelect(), result);
                }
            }
        }
        if (select instanceof PlainSelect plainSelect) {
            result.add(plainSelect);
            collectFromItem(plainSelect.getFromItem(), result);
            if (plainSelect.getJoins() != null) {
                for (Join join : plainSelect.getJoins()) {
                    collectFromItem(join.getRightItem(), result);
                }
            }
        } else if (select instanceof SetOperationList setOperationList) {
            for (Select branch : setOperationList.getSelects()) {
                collect(branch, result);
            }
        } else if (select instanceof ParenthesedSelect parenthesedSelect) {
            collect(parenthesedSelect.getSelect(), result);
        }
    }

    private static void collectFromItem(FromItem fromItem, List<PlainSelect> result) {
        if (fromItem instanceof ParenthesedSelect parenthesedSelect) {
            collect(parenthesedSelect.getSelect(), result);
        }
    }

    private static void addTable(FromItem fromItem, Set<String> names) {
        if (fromItem instanceof Table table) {
            names.add(SqlIdentifiers.unquote(table.getName()));
        }
    }
}

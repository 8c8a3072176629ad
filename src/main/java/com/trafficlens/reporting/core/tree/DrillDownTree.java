package com.trafficlens.reporting.core.tree;

import com.trafficlens.reporting.core.exception.ReconciliationMismatchException;
import com.trafficlens.reporting.core.model.AggregateRow;
import com.trafficlens.reporting.core.model.ReportRow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 下钻树组装
 * 树是不可变的：每次挂载子节点都返回新树。查找只遍历已加载节点，不触发任何查询。
 */
public final class DrillDownTree {

    private DrillDownTree() {
    }

    /**
     * 单层聚合结果 -> 树节点
     */
    public static List<ReportRow> toRows(String parentKey, int depth, int dimensionCount, List<AggregateRow> rows) {
        List<ReportRow> result = new ArrayList<>(rows.size());
        for (AggregateRow row : rows) {
            String key = RowKey.child(parentKey, row.value());
            String attribute = row.label() == null || row.label().isBlank()
                    ? RowKey.normalize(row.value())
                    : row.label();
            ReportRow node = new ReportRow(key, attribute, depth, depth < dimensionCount - 1, row.metrics(), null);
            RowKey.verifyDepth(node.key(), node.depth());
            result.add(node);
        }
        return result;
    }

    /**
     * 深度优先查找，仅限已加载节点
     */
    public static Optional<ReportRow> findByKey(List<ReportRow> tree, String key) {
        for (ReportRow row : tree) {
            if (row.key().equals(key)) {
                return Optional.of(row);
            }
            if (row.children() != null && key.startsWith(row.key() + RowKey.SEPARATOR)) {
                Optional<ReportRow> found = findByKey(row.children(), key);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 把 rows 挂到 parentKey 对应的节点下，返回新树
     */
    public static List<ReportRow> attachChildren(List<ReportRow> tree, String parentKey, List<ReportRow> rows) {
        ReportRow parent = findByKey(tree, parentKey).orElseThrow(() -> new ReconciliationMismatchException(
                "Parent row '" + parentKey + "' is not loaded"));
        for (ReportRow child : rows) {
            RowKey.verifyDepth(child.key(), child.depth());
            if (child.depth() != parent.depth() + 1 || !RowKey.isChildOf(child.key(), parentKey)) {
                throw new ReconciliationMismatchException(String.format(
                        "Row '%s' (depth %d) cannot be attached under '%s' (depth %d)",
                        child.key(), child.depth(), parentKey, parent.depth()));
            }
        }
        return replace(tree, parentKey, rows);
    }

    private static List<ReportRow> replace(List<ReportRow> tree, String parentKey, List<ReportRow> children) {
        List<ReportRow> result = new ArrayList<>(tree.size());
        for (ReportRow row : tree) {
            if (row.key().equals(parentKey)) {
                result.add(row.withChildren(children));
            } else if (row.children() != null && parentKey.startsWith(row.key() + RowKey.SEPARATOR)) {
                result.add(row.withChildren(replace(row.children(), parentKey, children)));
            } else {
                result.add(row);
            }
        }
        return result;
    }

    /**
     * 维度路径变化后重新计算展开标记
     */
    public static List<ReportRow> updateHasChildren(List<ReportRow> tree, int dimensionCount) {
        List<ReportRow> result = new ArrayList<>(tree.size());
        for (ReportRow row : tree) {
            ReportRow updated = row.withHasChildren(row.depth() < dimensionCount - 1);
            if (updated.children() != null) {
                updated = updated.withChildren(updateHasChildren(updated.children(), dimensionCount));
            }
            result.add(updated);
        }
        return result;
    }

    /**
     * 已展开的行键按层级分组（层级由行键推出）
     */
    public static SortedMap<Integer, List<String>> groupKeysByDepth(Collection<String> keys) {
        SortedMap<Integer, List<String>> grouped = new TreeMap<>();
        for (String key : keys) {
            grouped.computeIfAbsent(RowKey.decode(key).depth(), d -> new ArrayList<>()).add(key);
        }
        return grouped;
    }

    /**
     * 整棵树的 depth / 行键一致性检查
     */
    public static void verify(List<ReportRow> tree) {
        for (ReportRow row : tree) {
            RowKey.verifyDepth(row.key(), row.depth());
            if (row.children() != null) {
                verify(row.children());
            }
        }
    }
}

package com.findinpath.hierarchy.jdbc;

import com.findinpath.hierarchy.Utils;
import com.findinpath.hierarchy.model.HierarchyKind;
import com.findinpath.hierarchy.model.NestedSetNode;
import com.findinpath.hierarchy.model.TreeStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.findinpath.hierarchy.jdbc.Constants.TZ_UTC;

/**
 * Data access to the nested set table of a single {@link HierarchyKind}.
 * <p>
 * The repository works on the connection it gets. Transaction boundaries are owned by the caller.
 * The SQL templates receive the table name of the kind as their <code>%1$s</code> argument.
 */
public class NestedSetNodeRepository {

    private static final String COLUMNS =
            "id, parent_id, lft, rgt, depth, ordering, label, slug, description, active, created, updated ";

    private static final String SELECT_NESTED_SET_NODE_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE id = ?";
    private static final String SELECT_NESTED_SET_NODES_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "ORDER BY lft, id";
    private static final String SELECT_CHILDREN_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE parent_id = ? " +
                    "ORDER BY ordering, lft";
    private static final String SELECT_ROOTS_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE parent_id IS NULL " +
                    "ORDER BY ordering, lft";
    private static final String SELECT_SIBLINGS_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE parent_id = ? AND id <> ? " +
                    "ORDER BY ordering, lft";
    private static final String SELECT_ROOT_SIBLINGS_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE parent_id IS NULL AND id <> ? " +
                    "ORDER BY ordering, lft";
    private static final String SELECT_DESCENDANTS_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE lft > ? AND rgt < ? " +
                    "ORDER BY lft";
    private static final String SELECT_DESCENDANTS_PAGE_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE lft > ? AND rgt < ? " +
                    "ORDER BY lft " +
                    "LIMIT ? OFFSET ?";
    private static final String SELECT_ANCESTORS_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE lft < ? AND rgt > ? " +
                    "ORDER BY lft";
    private static final String SELECT_SUBTREE_SQL =
            "SELECT " + COLUMNS +
                    "FROM %1$s " +
                    "WHERE lft >= ? AND rgt <= ? " +
                    "ORDER BY lft";

    private static final String SELECT_IS_DESCENDANT_SQL =
            "SELECT EXISTS(" +
                    "SELECT 1 FROM %1$s a, %1$s d " +
                    "WHERE a.id = ? AND d.id = ? " +
                    "AND a.lft < d.lft AND a.rgt > d.rgt)";
    private static final String COUNT_CHILDREN_SQL =
            "SELECT COUNT(*) FROM %1$s WHERE parent_id = ?";
    private static final String COUNT_DESCENDANTS_SQL =
            "SELECT COUNT(*) FROM %1$s WHERE lft > ? AND rgt < ?";
    // detached subtrees live in the negative range and are ignored
    private static final String SELECT_MAX_RIGHT_SQL =
            "SELECT COALESCE(MAX(rgt), 0) FROM %1$s WHERE rgt > 0";
    private static final String SELECT_TREE_HEIGHT_SQL =
            "SELECT COALESCE(MAX(depth), 0) FROM %1$s";
    private static final String SELECT_LEVEL_WIDTH_SQL =
            "SELECT COUNT(*) FROM %1$s WHERE depth = ?";
    private static final String SELECT_STATISTICS_SQL =
            "SELECT COUNT(*), " +
                    "COALESCE(MAX(depth), 0), " +
                    "COUNT(*) FILTER (WHERE parent_id IS NULL), " +
                    "COUNT(*) FILTER (WHERE rgt = lft + 1), " +
                    "COALESCE(AVG(depth), 0), " +
                    "COALESCE((SELECT MAX(width) FROM (SELECT COUNT(*) AS width FROM %1$s GROUP BY depth) level_widths), 0) " +
                    "FROM %1$s";

    private static final String INSERT_NESTED_SET_NODE_SQL =
            "INSERT INTO %1$s (id, parent_id, lft, rgt, depth, ordering, label, slug, description, active, created, updated) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String DELETE_SUBTREE_SQL =
            "DELETE FROM %1$s WHERE lft >= ? AND rgt <= ?";

    private static final String UPDATE_RIGHT_TO_MAKE_SPACE_SQL =
            "UPDATE %1$s SET rgt = rgt + ?, updated = ? WHERE rgt >= ?";
    private static final String UPDATE_LEFT_TO_MAKE_SPACE_SQL =
            "UPDATE %1$s SET lft = lft + ?, updated = ? WHERE lft >= ?";
    private static final String UPDATE_RIGHT_TO_CLOSE_GAP_SQL =
            "UPDATE %1$s SET rgt = rgt - ?, updated = ? WHERE rgt > ?";
    private static final String UPDATE_LEFT_TO_CLOSE_GAP_SQL =
            "UPDATE %1$s SET lft = lft - ?, updated = ? WHERE lft > ?";

    private static final String UPDATE_DETACH_SUBTREE_SQL =
            "UPDATE %1$s SET lft = lft - ?, rgt = rgt - ? WHERE lft >= ? AND rgt <= ?";
    private static final String UPDATE_ATTACH_DETACHED_SUBTREE_SQL =
            "UPDATE %1$s SET lft = lft + ?, rgt = rgt + ?, depth = depth + ?, updated = ? WHERE lft < 0";
    private static final String UPDATE_PARENT_SQL =
            "UPDATE %1$s SET parent_id = ?, updated = ? WHERE id = ?";

    private static final String UPDATE_CHILDREN_ORDERING_SQL =
            "UPDATE %1$s t SET ordering = s.position, updated = ? " +
                    "FROM (SELECT id, ROW_NUMBER() OVER (ORDER BY lft) - 1 AS position " +
                    "      FROM %1$s WHERE parent_id = ?) s " +
                    "WHERE t.id = s.id AND t.ordering <> s.position";
    private static final String UPDATE_ROOTS_ORDERING_SQL =
            "UPDATE %1$s t SET ordering = s.position, updated = ? " +
                    "FROM (SELECT id, ROW_NUMBER() OVER (ORDER BY lft) - 1 AS position " +
                    "      FROM %1$s WHERE parent_id IS NULL) s " +
                    "WHERE t.id = s.id AND t.ordering <> s.position";

    private static final String UPDATE_COORDINATES_SQL =
            "UPDATE %1$s SET lft = ?, rgt = ?, depth = ?, ordering = ?, updated = ? WHERE id = ?";

    private static final String LOCK_TABLE_SQL =
            "LOCK TABLE %1$s IN SHARE ROW EXCLUSIVE MODE";

    private static final Logger LOGGER = LoggerFactory.getLogger(NestedSetNodeRepository.class);

    private final Connection connection;
    private final HierarchyKind kind;

    public NestedSetNodeRepository(Connection connection, HierarchyKind kind) {
        this.connection = connection;
        this.kind = kind;
    }

    public HierarchyKind getKind() {
        return kind;
    }

    /**
     * Acquires the structural lock of the kind for the rest of the current transaction.
     * Structural writers of the same kind are serialized while plain readers are not blocked.
     *
     * @param lockTimeout how long to wait for the lock before the database aborts the statement
     */
    public void lockForStructuralChange(Duration lockTimeout) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("SET LOCAL lock_timeout = " + lockTimeout.toMillis());
            stmt.execute(sql(LOCK_TABLE_SQL));
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
    }

    public Optional<NestedSetNode> getNestedSetNode(UUID id) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(SELECT_NESTED_SET_NODE_SQL))) {

            pstmt.setObject(1, id);

            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(toNestedSetNode(rs));
                }
            }
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }

        return Optional.empty();
    }

    public List<NestedSetNode> getNestedSetNodes() {
        return query(SELECT_NESTED_SET_NODES_SQL);
    }

    public List<NestedSetNode> getChildren(UUID parentId) {
        return query(SELECT_CHILDREN_SQL, parentId);
    }

    public List<NestedSetNode> getRoots() {
        return query(SELECT_ROOTS_SQL);
    }

    public List<NestedSetNode> getSiblings(NestedSetNode nestedSetNode) {
        if (nestedSetNode.isRoot()) {
            return query(SELECT_ROOT_SIBLINGS_SQL, nestedSetNode.getId());
        }
        return query(SELECT_SIBLINGS_SQL, nestedSetNode.getParentId(), nestedSetNode.getId());
    }

    public List<NestedSetNode> getDescendants(NestedSetNode nestedSetNode) {
        return query(SELECT_DESCENDANTS_SQL, nestedSetNode.getLeft(), nestedSetNode.getRight());
    }

    public List<NestedSetNode> getDescendants(NestedSetNode nestedSetNode, long limit, long offset) {
        return query(SELECT_DESCENDANTS_PAGE_SQL, nestedSetNode.getLeft(), nestedSetNode.getRight(), limit, offset);
    }

    public List<NestedSetNode> getAncestors(NestedSetNode nestedSetNode) {
        return query(SELECT_ANCESTORS_SQL, nestedSetNode.getLeft(), nestedSetNode.getRight());
    }

    public List<NestedSetNode> getSubtree(NestedSetNode nestedSetNode) {
        return query(SELECT_SUBTREE_SQL, nestedSetNode.getLeft(), nestedSetNode.getRight());
    }

    public boolean isDescendant(UUID ancestorId, UUID descendantId) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(SELECT_IS_DESCENDANT_SQL))) {
            pstmt.setObject(1, ancestorId);
            pstmt.setObject(2, descendantId);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
            return false;
        }
    }

    public long countChildren(UUID parentId) {
        return queryForLong(COUNT_CHILDREN_SQL, parentId);
    }

    public long countDescendants(NestedSetNode nestedSetNode) {
        return queryForLong(COUNT_DESCENDANTS_SQL, nestedSetNode.getLeft(), nestedSetNode.getRight());
    }

    public long getMaxRight() {
        return queryForLong(SELECT_MAX_RIGHT_SQL);
    }

    public int getTreeHeight() {
        return (int) queryForLong(SELECT_TREE_HEIGHT_SQL);
    }

    public long getLevelWidth(int depth) {
        return queryForLong(SELECT_LEVEL_WIDTH_SQL, depth);
    }

    public TreeStatistics getStatistics() {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(SELECT_STATISTICS_SQL));
             ResultSet rs = pstmt.executeQuery()) {
            if (rs.next()) {
                return new TreeStatistics(rs.getLong(1),
                        rs.getInt(2),
                        rs.getLong(3),
                        rs.getLong(4),
                        rs.getDouble(5),
                        rs.getLong(6));
            }
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
        return new TreeStatistics(0, 0, 0, 0, 0, 0);
    }

    public void insertNode(NestedSetNode nestedSetNode) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(INSERT_NESTED_SET_NODE_SQL))) {

            pstmt.setObject(1, nestedSetNode.getId());
            setUuid(pstmt, 2, nestedSetNode.getParentId());
            pstmt.setLong(3, nestedSetNode.getLeft());
            pstmt.setLong(4, nestedSetNode.getRight());
            pstmt.setInt(5, nestedSetNode.getDepth());
            pstmt.setInt(6, nestedSetNode.getOrdering());
            pstmt.setString(7, nestedSetNode.getLabel());
            pstmt.setString(8, nestedSetNode.getSlug());
            pstmt.setString(9, nestedSetNode.getDescription());
            pstmt.setBoolean(10, nestedSetNode.isActive());
            pstmt.setTimestamp(11, new Timestamp(nestedSetNode.getCreated().toEpochMilli()), TZ_UTC);
            pstmt.setTimestamp(12, new Timestamp(nestedSetNode.getUpdated().toEpochMilli()), TZ_UTC);

            pstmt.executeUpdate();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
    }

    /**
     * Opens a gap of the given width right before the <code>insertionPoint</code> coordinate.
     * Every ancestor of the insertion point gets widened and every node placed after it gets shifted.
     */
    public void makeSpace(long insertionPoint, long width) {
        LOGGER.debug("Making space of width {} at {} in the {} table", width, insertionPoint, kind.getTableName());
        shift(UPDATE_RIGHT_TO_MAKE_SPACE_SQL, width, insertionPoint);
        shift(UPDATE_LEFT_TO_MAKE_SPACE_SQL, width, insertionPoint);
    }

    /**
     * Closes the gap of the given width which ends at the <code>right</code> coordinate.
     */
    public void closeGap(long right, long width) {
        LOGGER.debug("Closing the gap of width {} ending at {} in the {} table", width, right, kind.getTableName());
        // left first, so that lft < rgt holds after each statement
        shift(UPDATE_LEFT_TO_CLOSE_GAP_SQL, width, right);
        shift(UPDATE_RIGHT_TO_CLOSE_GAP_SQL, width, right);
    }

    /**
     * @return the amount of deleted rows
     */
    public int deleteSubtree(long left, long right) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(DELETE_SUBTREE_SQL))) {
            pstmt.setLong(1, left);
            pstmt.setLong(2, right);
            return pstmt.executeUpdate();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
            return 0;
        }
    }

    /**
     * Moves the coordinates of the subtree <code>[left, right]</code> out of the way by subtracting
     * the given offset. The offset must be greater than the current maximum right coordinate so that
     * the detached subtree ends up entirely in the negative range, which is not touched by
     * {@link #makeSpace(long, long)} and {@link #closeGap(long, long)}.
     */
    public void detachSubtree(long left, long right, long offset) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(UPDATE_DETACH_SUBTREE_SQL))) {
            pstmt.setLong(1, offset);
            pstmt.setLong(2, offset);
            pstmt.setLong(3, left);
            pstmt.setLong(4, right);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
    }

    public void attachDetachedSubtree(long offset, int depthDelta) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(UPDATE_ATTACH_DETACHED_SUBTREE_SQL))) {
            pstmt.setLong(1, offset);
            pstmt.setLong(2, offset);
            pstmt.setInt(3, depthDelta);
            pstmt.setTimestamp(4, now(), TZ_UTC);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
    }

    public void updateParent(UUID id, UUID parentId) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(UPDATE_PARENT_SQL))) {
            setUuid(pstmt, 1, parentId);
            pstmt.setTimestamp(2, now(), TZ_UTC);
            pstmt.setObject(3, id);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
    }

    /**
     * Renumbers densely (<code>0..k-1</code>, left to right) the ordering of the children of the given parent.
     *
     * @param parentId the parent node or <code>null</code> for the roots of the kind
     */
    public void resequenceChildren(UUID parentId) {
        var template = parentId == null ? UPDATE_ROOTS_ORDERING_SQL : UPDATE_CHILDREN_ORDERING_SQL;
        try (PreparedStatement pstmt = connection.prepareStatement(sql(template))) {
            pstmt.setTimestamp(1, now(), TZ_UTC);
            if (parentId != null) {
                pstmt.setObject(2, parentId);
            }
            pstmt.executeUpdate();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
    }

    public void updateAll(Iterable<NestedSetNode> nestedSetNodes) {
        LOGGER.info("Updating the coordinates of the {} table", kind.getTableName());

        try (PreparedStatement pstmt = connection.prepareStatement(sql(UPDATE_COORDINATES_SQL))) {
            var updated = now();
            for (var nestedSetNode : nestedSetNodes) {
                pstmt.setLong(1, nestedSetNode.getLeft());
                pstmt.setLong(2, nestedSetNode.getRight());
                pstmt.setInt(3, nestedSetNode.getDepth());
                pstmt.setInt(4, nestedSetNode.getOrdering());
                pstmt.setTimestamp(5, updated, TZ_UTC);
                pstmt.setObject(6, nestedSetNode.getId());
                pstmt.addBatch();
            }

            pstmt.executeBatch();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
    }

    private void shift(String template, long width, long threshold) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(template))) {
            pstmt.setLong(1, width);
            pstmt.setTimestamp(2, now(), TZ_UTC);
            pstmt.setLong(3, threshold);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
        }
    }

    private List<NestedSetNode> query(String template, Object... parameters) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(template))) {
            for (int i = 0; i < parameters.length; i++) {
                pstmt.setObject(i + 1, parameters[i]);
            }
            try (ResultSet rs = pstmt.executeQuery()) {
                var result = new ArrayList<NestedSetNode>();
                while (rs.next()) {
                    result.add(toNestedSetNode(rs));
                }
                return result;
            }
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
            return null;
        }
    }

    private long queryForLong(String template, Object... parameters) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql(template))) {
            for (int i = 0; i < parameters.length; i++) {
                pstmt.setObject(i + 1, parameters[i]);
            }
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
            return 0;
        }
    }

    private String sql(String template) {
        return String.format(template, kind.getTableName());
    }

    private static void setUuid(PreparedStatement pstmt, int parameterIndex, UUID value) throws SQLException {
        if (value == null) {
            pstmt.setNull(parameterIndex, Types.OTHER);
        } else {
            pstmt.setObject(parameterIndex, value);
        }
    }

    private static Timestamp now() {
        return new Timestamp(Instant.now().toEpochMilli());
    }

    private static NestedSetNode toNestedSetNode(ResultSet rs) throws SQLException {
        var nestedSetNode = new NestedSetNode();
        nestedSetNode.setId(rs.getObject(1, UUID.class));
        nestedSetNode.setParentId(rs.getObject(2, UUID.class));
        nestedSetNode.setLeft(rs.getLong(3));
        nestedSetNode.setRight(rs.getLong(4));
        nestedSetNode.setDepth(rs.getInt(5));
        nestedSetNode.setOrdering(rs.getInt(6));
        nestedSetNode.setLabel(rs.getString(7));
        nestedSetNode.setSlug(rs.getString(8));
        nestedSetNode.setDescription(rs.getString(9));
        nestedSetNode.setActive(rs.getBoolean(10));
        nestedSetNode.setCreated(rs.getTimestamp(11, TZ_UTC).toInstant());
        nestedSetNode.setUpdated(rs.getTimestamp(12, TZ_UTC).toInstant());
        return nestedSetNode;
    }
}

package com.findinpath.hierarchy;

import com.findinpath.hierarchy.model.HierarchyKind;
import com.findinpath.hierarchy.model.NodeAttributes;
import com.findinpath.hierarchy.service.HierarchyTreeCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

/**
 * Demonstrates how the nested set model of a hierarchy evolves while nodes get added,
 * moved and removed through the {@link com.findinpath.hierarchy.service.HierarchyStore}.
 * <p>
 * NOTE that adding, moving or removing a node involves changing the left and right coordinates
 * of a big portion of the nested set.
 *
 * @see AbstractHierarchyStoreTest
 */
public class DemoHierarchyStoreTest extends AbstractHierarchyStoreTest {
    private static final Logger LOGGER = LoggerFactory.getLogger(DemoHierarchyStoreTest.class);

    private HierarchyTreeCache hierarchyTreeCache;

    @BeforeEach
    public void setup() {
        super.setup();

        hierarchyTreeCache = new HierarchyTreeCache(hierarchyStore::getTree, eventBus);
    }

    @AfterEach
    public void tearDown() {
        super.tearDown();
    }

    /**
     * Builds the following nested set model:
     *
     * <pre>
     * |1| Food |18|
     *     ├── |2| Fruit |11|
     *     │       ├── |3| Red |6|
     *     │       │       └── |4| Cherry |5|
     *     │       └── |7| Yellow |10|
     *     │               └── |8| Banana |9|
     *     └── |12| Meat |17|
     *              ├── |13| Beef |14|
     *              └── |15| Pork |16|
     * </pre>
     */
    @Test
    public void foodTreeDemo() {
        var kind = HierarchyKind.TAXONOMY;
        var foodNodeId = insertRootNode(kind, "Food");
        var fruitNodeId = insertNode(kind, "Fruit", foodNodeId);
        var redFruitNodeId = insertNode(kind, "Red", fruitNodeId);
        insertNode(kind, "Cherry", redFruitNodeId);
        var yellowFruitNodeId = insertNode(kind, "Yellow", fruitNodeId);
        insertNode(kind, "Banana", yellowFruitNodeId);
        var meatNodeId = insertNode(kind, "Meat", foodNodeId);
        insertNode(kind, "Beef", meatNodeId);
        insertNode(kind, "Pork", meatNodeId);

        var tree = logTreeContent(kind);

        assertThat(tree, equalTo(
                "|1| Food |18|\n" +
                        "    ├── |2| Fruit |11|\n" +
                        "    │       ├── |3| Red |6|\n" +
                        "    │       │       └── |4| Cherry |5|\n" +
                        "    │       └── |7| Yellow |10|\n" +
                        "    │               └── |8| Banana |9|\n" +
                        "    └── |12| Meat |17|\n" +
                        "             ├── |13| Beef |14|\n" +
                        "             └── |15| Pork |16|\n"));
        assertThat(hierarchyStore.validate(kind), is(empty()));
    }

    /**
     * Grows the menu successively over time and reorganizes it afterwards.
     * Before the reorganization the menu looks like:
     *
     * <pre>
     * |1| Clothing |14|
     *     ├── |2| Men's |5|
     *     │       └── |3| Suits |4|
     *     └── |6| Women's |13|
     *             ├── |7| Dresses |8|
     *             ├── |9| Skirts |10|
     *             └── |11| Blouses |12|
     * </pre>
     */
    @Test
    public void successiveChangesToTheTreeDemo() {
        var kind = HierarchyKind.MENU;

        var clothingNodeId = insertRootNode(kind, "Clothing");
        assertThat(logTreeContent(kind), equalTo("|1| Clothing |2|\n"));

        var mensNodeId = insertNode(kind, "Men's", clothingNodeId);
        var womensNodeId = insertNode(kind, "Women's", clothingNodeId);
        logTreeContent(kind);

        insertNode(kind, "Suits", mensNodeId);
        insertNode(kind, "Dresses", womensNodeId);
        var skirtsNodeId = insertNode(kind, "Skirts", womensNodeId);
        insertNode(kind, "Blouses", womensNodeId);
        assertThat(logTreeContent(kind), equalTo(
                "|1| Clothing |14|\n" +
                        "    ├── |2| Men's |5|\n" +
                        "    │       └── |3| Suits |4|\n" +
                        "    └── |6| Women's |13|\n" +
                        "            ├── |7| Dresses |8|\n" +
                        "            ├── |9| Skirts |10|\n" +
                        "            └── |11| Blouses |12|\n"));

        // skirts are sold from now on in both departments, placed first among the men's categories
        hierarchyStore.moveNode(kind, skirtsNodeId, mensNodeId, 0);
        assertThat(logTreeContent(kind), equalTo(
                "|1| Clothing |14|\n" +
                        "    ├── |2| Men's |7|\n" +
                        "    │       ├── |3| Skirts |4|\n" +
                        "    │       └── |5| Suits |6|\n" +
                        "    └── |8| Women's |13|\n" +
                        "            ├── |9| Dresses |10|\n" +
                        "            └── |11| Blouses |12|\n"));

        hierarchyStore.deleteNode(kind, womensNodeId);
        assertThat(logTreeContent(kind), equalTo(
                "|1| Clothing |8|\n" +
                        "    └── |2| Men's |7|\n" +
                        "            ├── |3| Skirts |4|\n" +
                        "            └── |5| Suits |6|\n"));
        assertThat(hierarchyStore.validate(kind), is(empty()));
    }

    @Test
    public void kindsEvolveIndependentlyDemo() {
        var acmeNodeId = insertRootNode(HierarchyKind.ORGANIZATION, "ACME");
        insertNode(HierarchyKind.ORGANIZATION, "Engineering", acmeNodeId);
        var threadNodeId = insertRootNode(HierarchyKind.COMMENT, "Nice article");
        insertNode(HierarchyKind.COMMENT, "Thanks!", threadNodeId);
        insertRootNode(HierarchyKind.MEDIA, "Holidays");

        assertThat(logTreeContent(HierarchyKind.ORGANIZATION),
                equalTo("|1| ACME |4|\n    └── |2| Engineering |3|\n"));
        assertThat(logTreeContent(HierarchyKind.COMMENT),
                equalTo("|1| Nice article |4|\n    └── |2| Thanks! |3|\n"));
        assertThat(hierarchyTreeCache.getTree(HierarchyKind.MEDIA), hasSize(1));
        assertThat(hierarchyTreeCache.getTree(HierarchyKind.TAXONOMY), is(empty()));
    }

    private UUID insertRootNode(HierarchyKind kind, String label) {
        return hierarchyStore.insertRootNode(kind, NodeAttributes.of(label)).getId();
    }

    private UUID insertNode(HierarchyKind kind, String label, UUID parentId) {
        return hierarchyStore.insertNode(kind, parentId, NodeAttributes.of(label)).getId();
    }

    private String logTreeContent(HierarchyKind kind) {
        var rootNode = hierarchyTreeCache.getTree(kind).get(0);
        LOGGER.info("{} nested set node current configuration: \n{}", kind, rootNode);
        return rootNode.toString();
    }
}

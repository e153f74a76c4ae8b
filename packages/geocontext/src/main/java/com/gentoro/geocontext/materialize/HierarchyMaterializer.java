package com.gentoro.geocontext.materialize;

import com.gentoro.geocontext.dataset.ExternalItem;
import com.gentoro.geocontext.dataset.HierarchyNode;
import com.gentoro.geocontext.graph.GraphNodeRef;
import com.gentoro.geocontext.graph.GraphStore;
import com.gentoro.geocontext.graph.PendingWrite;
import com.gentoro.geocontext.layout.Layout;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a {@link HierarchyNode} against the graph and produces one {@link PendingWrite} per node
 * it has to create and per item it attaches.
 *
 * <p>The walk is lazy and depth-first pre-order: nothing touches the store until the returned
 * cursor is pulled, and the write creating a node is always returned before any write of its
 * subtree. Each group costs exactly one {@link GraphStore#resolveChildren} call; its entries are
 * matched against the existing children by name, so an entry whose node already exists is reused
 * without a write. Store exceptions surface from {@link Cursor#hasNext()} unchanged.
 */
public class HierarchyMaterializer {
  private static final org.slf4j.Logger log =
      com.gentoro.geocontext.logging.LoggingService.getLogger(HierarchyMaterializer.class);

  private final GraphStore store;

  public HierarchyMaterializer(GraphStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * @param context context the created relations belong to
   * @param parent node the top level of {@code node} is attached to
   * @param node hierarchy to materialize below {@code parent}
   * @param layout node types and relations per depth
   * @param depth layout depth of the top level of {@code node}
   */
  public Cursor materialize(
      GraphNodeRef context, GraphNodeRef parent, HierarchyNode node, Layout layout, int depth) {
    return new Cursor(context, parent, node, layout, depth);
  }

  /** Same walk as {@link #materialize}, exposed as a sequential ordered stream. */
  public Stream<PendingWrite> stream(
      GraphNodeRef context, GraphNodeRef parent, HierarchyNode node, Layout layout, int depth) {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            materialize(context, parent, node, layout, depth),
            Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /** Pull-driven pre-order traversal. Not thread-safe; one consumer per cursor. */
  public final class Cursor implements Iterator<PendingWrite> {
    private final GraphNodeRef context;
    private final Layout layout;
    private final Deque<Frame> stack = new ArrayDeque<>();

    private PendingWrite lookahead;
    private int createdNodes;
    private int reusedNodes;
    private int attachedItems;

    private Cursor(
        GraphNodeRef context, GraphNodeRef parent, HierarchyNode root, Layout layout, int depth) {
      this.context = Objects.requireNonNull(context, "context");
      this.layout = Objects.requireNonNull(layout, "layout");
      stack.push(frameFor(Objects.requireNonNull(parent, "parent"), root, depth));
    }

    @Override
    public boolean hasNext() {
      if (lookahead == null) {
        lookahead = advance();
      }
      return lookahead != null;
    }

    @Override
    public PendingWrite next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      PendingWrite write = lookahead;
      lookahead = null;
      return write;
    }

    private PendingWrite advance() {
      while (!stack.isEmpty()) {
        Frame top = stack.peek();
        if (!top.hasMore()) {
          stack.pop();
          continue;
        }
        PendingWrite write = top.step();
        if (write != null) {
          return write;
        }
      }
      return null;
    }

    private Frame frameFor(GraphNodeRef parent, HierarchyNode node, int depth) {
      return node.accept(
          new HierarchyNode.Visitor<Frame>() {
            @Override
            public Frame visitGroup(HierarchyNode.Group group) {
              return new GroupFrame(parent, group, depth);
            }

            @Override
            public Frame visitLeaf(HierarchyNode.Leaf leaf) {
              return new LeafFrame(parent, leaf.items());
            }
          });
    }

    /** Nodes created so far. */
    public int createdNodes() {
      return createdNodes;
    }

    /** Existing nodes matched by name so far. */
    public int reusedNodes() {
      return reusedNodes;
    }

    /** Item attachments issued so far. */
    public int attachedItems() {
      return attachedItems;
    }

    private abstract class Frame {
      abstract boolean hasMore();

      /** Process one entry; may return null when the entry needed no write. */
      abstract PendingWrite step();
    }

    private final class GroupFrame extends Frame {
      private final GraphNodeRef parent;
      private final int depth;
      private final Iterator<Map.Entry<String, HierarchyNode>> entries;
      private Map<String, GraphNodeRef> existing;

      GroupFrame(GraphNodeRef parent, HierarchyNode.Group group, int depth) {
        this.parent = parent;
        this.depth = depth;
        this.entries = group.children().entrySet().iterator();
      }

      @Override
      boolean hasMore() {
        return entries.hasNext();
      }

      @Override
      PendingWrite step() {
        String relation = layout.relation(depth);
        if (existing == null) {
          existing = indexByName(store.resolveChildren(parent, relation));
        }
        Map.Entry<String, HierarchyNode> entry = entries.next();
        String name = entry.getKey();
        GraphNodeRef child = existing.get(name);
        PendingWrite write = null;
        if (child == null) {
          child = store.createNode(name, layout.nodeType(depth));
          write = store.attach(parent, child, relation, context);
          createdNodes++;
          log.debug(
              "Created {} '{}' below '{}' via {}", child.type(), name, parent.name(), relation);
        } else {
          reusedNodes++;
          log.trace("Reusing {} '{}' below '{}'", child.type(), name, parent.name());
        }
        stack.push(frameFor(child, entry.getValue(), depth + 1));
        return write;
      }
    }

    private final class LeafFrame extends Frame {
      private final GraphNodeRef parent;
      private final Iterator<ExternalItem> items;

      LeafFrame(GraphNodeRef parent, List<ExternalItem> items) {
        this.parent = parent;
        this.items = items.iterator();
      }

      @Override
      boolean hasMore() {
        return items.hasNext();
      }

      @Override
      PendingWrite step() {
        ExternalItem item = items.next();
        attachedItems++;
        return store.attachExternalReference(
            context, parent, item.externalId(), item.name(), layout.referenceRelation());
      }
    }
  }

  private static Map<String, GraphNodeRef> indexByName(List<GraphNodeRef> children) {
    Map<String, GraphNodeRef> byName = new HashMap<>();
    for (GraphNodeRef child : children) {
      byName.putIfAbsent(child.name(), child);
    }
    return byName;
  }
}

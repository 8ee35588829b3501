package org.textcurator.service.chunking.strategy;

import org.textcurator.service.language.LanguageProfile;
import org.textcurator.service.language.SectionHeader;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Heading tree of a document, stored as an arena: nodes live in document order
 * and refer to each other by index. Node 0 is the root and covers the text
 * before the first heading.
 */
final class SectionTree {

    static final int ROOT = 0;

    private final List<Node> nodes;

    private SectionTree(List<Node> nodes) {
        this.nodes = nodes;
    }

    static SectionTree build(String text, LanguageProfile profile) {
        List<SectionHeader> headers = profile.findSectionHeaders(text);
        List<Node> nodes = new ArrayList<>(headers.size() + 1);

        int rootEnd = headers.isEmpty() ? text.length() : headers.get(0).start();
        Node root = new Node(0, rootEnd, 0, null, -1);
        root.path = "";
        root.weight = profile.tokenWeight(text, 0, rootEnd);
        nodes.add(root);

        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < headers.size(); i++) {
            SectionHeader header = headers.get(i);
            int end = i + 1 < headers.size() ? headers.get(i + 1).start() : text.length();
            while (!open.isEmpty() && nodes.get(open.peek()).level >= header.level()) {
                open.pop();
            }
            int parent = open.isEmpty() ? ROOT : open.peek();

            Node node = new Node(header.start(), end, header.level(), header.text(), parent);
            node.firstChunkId = UUID.randomUUID().toString();
            node.weight = profile.tokenWeight(text, header.start(), end);
            Node parentNode = nodes.get(parent);
            node.path = parent == ROOT ? header.text() : parentNode.path + "/" + header.text();

            int index = nodes.size();
            nodes.add(node);
            parentNode.children.add(index);
            open.push(index);
        }
        return new SectionTree(nodes);
    }

    /**
     * Folds leaf sections lighter than {@code minWeight} into the following leaf
     * siblings at the same level. An absorbing section keeps its own path and title.
     */
    void mergeSmallLeaves(long minWeight) {
        for (Node parent : nodes) {
            List<Integer> siblings = parent.children;
            int i = 0;
            while (i < siblings.size()) {
                Node node = nodes.get(siblings.get(i));
                int j = i + 1;
                while (node.isLeaf() && node.weight < minWeight && j < siblings.size()) {
                    Node next = nodes.get(siblings.get(j));
                    if (!next.isLeaf() || next.level != node.level) {
                        break;
                    }
                    node.end = next.end;
                    node.weight += next.weight;
                    next.absorbed = true;
                    j++;
                }
                i = j;
            }
        }
    }

    int size() {
        return nodes.size();
    }

    Node node(int index) {
        return nodes.get(index);
    }

    /**
     * Hierarchy data for the chunks of {@code nodes[index]}.
     */
    HierarchyTag tagOf(int index) {
        Node node = nodes.get(index);
        String parentId = node.parent <= ROOT ? null : nodes.get(node.parent).firstChunkId;
        return new HierarchyTag(node.firstChunkId, node.level, parentId, node.title, node.path);
    }

    static final class Node {

        final int start;
        int end;
        final int level;
        final String title;
        final int parent;
        final List<Integer> children = new ArrayList<>();

        String firstChunkId;
        String path;
        long weight;
        boolean absorbed;

        Node(int start, int end, int level, String title, int parent) {
            this.start = start;
            this.end = end;
            this.level = level;
            this.title = title;
            this.parent = parent;
        }

        boolean isLeaf() {
            return children.isEmpty();
        }
    }
}

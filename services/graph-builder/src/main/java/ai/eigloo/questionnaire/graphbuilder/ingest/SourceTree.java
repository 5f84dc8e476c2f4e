package ai.eigloo.questionnaire.graphbuilder.ingest;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A parsed diagram source document.
 */
public final class SourceTree {

    private final SourceElement root;
    private final List<SourceElement> elements;

    public SourceTree(SourceElement root) {
        if (root == null) {
            throw new IllegalArgumentException("Source tree root cannot be null");
        }
        this.root = root;
        this.elements = Collections.unmodifiableList(flatten(root));
    }

    public SourceElement root() {
        return root;
    }

    /**
     * Every element in document order, root first.
     */
    public List<SourceElement> elements() {
        return elements;
    }

    public List<SourceElement> elements(String tag) {
        return elements.stream()
                .filter(element -> tag.equals(element.tag()))
                .toList();
    }

    private static List<SourceElement> flatten(SourceElement root) {
        List<SourceElement> ordered = new ArrayList<>();
        Deque<SourceElement> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SourceElement element = stack.pop();
            ordered.add(element);
            List<SourceElement> children = element.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ordered;
    }
}

package com.yongkangl.newick.io;

import com.yongkangl.newick.tree.Node;
import com.yongkangl.newick.tree.Tree;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Parses one Newick tree. Nested groups are tracked with an explicit stack of open nodes,
 * so nesting depth is not limited by the call stack.
 * <p>
 * Nodes are appended to the resulting {@link Tree} when their subtree closes:
 * {@code ((A,B),C)} gives A, B, (A,B), C and finally the root.
 * <p>
 * A parser instance is single use; the static {@code parse} methods create a fresh one per call.
 */
public class NewickParser {
    private static final Logger LOGGER = Logger.getLogger(NewickParser.class.getName());
    // Plain decimal only; Double.parseDouble alone would also take 1d, 2f, 0x1p3 and NaN
    private static final Pattern BRANCH_LENGTH = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    // Comment wins over quoting and quoting over structure; whichever was entered first stays active
    private enum Mode { NORMAL, QUOTED, COMMENT }

    private final String input;
    private final Tree tree;
    private final Deque<Node> frames;
    private Mode mode = Mode.NORMAL;
    private boolean lengthPending;
    private boolean terminated;
    private boolean sawContent;
    private boolean used;
    private Node implicitRoot;
    private int tokenIndex;

    public NewickParser(String input) {
        this.input = Validate.notNull(input, "input");
        this.tree = new Tree();
        this.frames = new ArrayDeque<>();
    }

    public static Tree parse(String input) {
        return new NewickParser(input).parse();
    }

    /**
     * Reads the whole reader before parsing. The reader is not closed.
     */
    public static Tree parse(Reader reader) throws IOException {
        BufferedReader br = new BufferedReader(reader);
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[8192];
        int n;
        while ((n = br.read(buffer)) != -1) {
            sb.append(buffer, 0, n);
        }
        return parse(sb.toString());
    }

    public static Tree parse(InputStream in) throws IOException {
        return parse(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public Tree parse() {
        if (used) {
            throw new IllegalStateException("NewickParser instances parse a single input");
        }
        used = true;
        frames.push(new Node(null));

        NewickTokenizer tokenizer = new NewickTokenizer(input);
        while (tokenizer.hasNext()) {
            NewickToken token = tokenizer.next();
            if (token.isSeparator()) {
                consumeSeparators(token.getText());
            } else {
                consumeValue(token.getText());
            }
            tokenIndex++;
        }
        finish();
        return tree;
    }

    private void consumeSeparators(String separators) {
        for (int i = 0; i < separators.length(); i++) {
            char sep = separators.charAt(i);
            if (mode == Mode.COMMENT && sep != ']') {
                current().appendComment(String.valueOf(sep));
                continue;
            }
            if (mode == Mode.QUOTED) {
                if (sep != '\'') {
                    labelTarget().appendLabel(String.valueOf(sep));
                    continue;
                }
                // '' inside quotes is an escaped quote
                if (i + 1 < separators.length() && separators.charAt(i + 1) == '\'') {
                    labelTarget().appendLabel("'");
                    i++;
                    continue;
                }
            }
            sawContent = true;
            dispatch(sep);
        }
    }

    private void dispatch(char sep) {
        switch (sep) {
            case '(': {
                requireOpen(sep);
                Node parent = frames.peek();
                Node child = new Node(parent);
                parent.addChild(child);
                frames.push(child);
                break;
            }
            case ')': {
                requireOpen(sep);
                Node parent = frames.peek().getParent();
                if (parent == null || parent == implicitRoot) {
                    throw new MalformedTreeException("')' without a matching '('", tokenIndex);
                }
                close();
                break;
            }
            case ',': {
                requireOpen(sep);
                Node closed = close();
                Node parent = closed.getParent();
                if (parent == null) {
                    parent = wrapUnderImplicitRoot(closed);
                }
                Node sibling = new Node(parent);
                parent.addChild(sibling);
                frames.push(sibling);
                break;
            }
            case ';': {
                requireOpen(sep);
                Node closed = close();
                if (implicitRoot != null && closed.getParent() == implicitRoot) {
                    close();
                }
                if (!frames.isEmpty()) {
                    throw new MalformedTreeException(frames.size() + " unclosed '(' before ';'", tokenIndex);
                }
                terminated = true;
                break;
            }
            case ':':
                lengthPending = true;
                break;
            case '\'':
                mode = mode == Mode.QUOTED ? Mode.NORMAL : Mode.QUOTED;
                break;
            case '[':
                mode = Mode.COMMENT;
                break;
            case ']':
                mode = Mode.NORMAL;
                break;
            default:
                throw new IllegalStateException("Not a separator: " + sep);
        }
    }

    private void consumeValue(String value) {
        if (mode == Mode.COMMENT) {
            sawContent = true;
            current().appendComment(stripNewlines(value));
            return;
        }
        String text = mode == Mode.QUOTED
                ? stripNewlines(value)
                : StringUtils.deleteWhitespace(value).replace('_', ' ');
        if (text.isEmpty()) {
            return;
        }
        sawContent = true;
        if (lengthPending) {
            Node node = labelTarget();
            if (!BRANCH_LENGTH.matcher(text).matches()) {
                throw new NumberFormatException("Invalid branch length '" + text + "' (token " + tokenIndex + ")");
            }
            node.setLength(Double.parseDouble(text));
            lengthPending = false;
        } else {
            labelTarget().appendLabel(text);
        }
    }

    private void finish() {
        if (mode == Mode.QUOTED) {
            throw new MalformedTreeException("Unterminated quoted label", tokenIndex);
        }
        if (mode == Mode.COMMENT) {
            throw new MalformedTreeException("Unterminated comment", tokenIndex);
        }
        if (!sawContent || terminated) {
            return;
        }
        requireNoPendingLength();
        if (implicitRoot != null && frames.peek().getParent() == implicitRoot) {
            close();
        }
        if (frames.size() > 1) {
            throw new MalformedTreeException((frames.size() - 1) + " unclosed '(' at end of input", tokenIndex);
        }
        close();
    }

    private Node close() {
        Node node = frames.pop();
        tree.addNode(node);
        return node;
    }

    private Node wrapUnderImplicitRoot(Node closed) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Top-level ',' at token " + tokenIndex + ", grouping siblings under an unlabelled root");
        }
        implicitRoot = new Node(null);
        closed.setParent(implicitRoot);
        implicitRoot.addChild(closed);
        frames.push(implicitRoot);
        return implicitRoot;
    }

    private void requireOpen(char sep) {
        if (terminated) {
            throw new MalformedTreeException("'" + sep + "' after the terminating ';'", tokenIndex);
        }
        requireNoPendingLength();
    }

    private void requireNoPendingLength() {
        if (lengthPending) {
            throw new MalformedTreeException("':' without a branch length", tokenIndex);
        }
    }

    // Comments after ';' belong to the root
    private Node current() {
        return frames.isEmpty() ? tree.getRoot() : frames.peek();
    }

    private Node labelTarget() {
        if (terminated) {
            throw new MalformedTreeException("Label or length after the terminating ';'", tokenIndex);
        }
        return frames.peek();
    }

    private static String stripNewlines(String value) {
        return StringUtils.remove(StringUtils.remove(value, '\n'), '\r');
    }
}

package com.flowuml.parser;

import com.flowuml.model.StartPoint;
import com.flowuml.model.Transition;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;

import static com.flowuml.parser.DiagramSyntax.*;

/**
 * State of one parse invocation: the graph under construction, the current node, the open branch
 * and loop frames, counters and diagnostics. Single use; never shared between threads or parses.
 */
final class ParseSession {

    private static final Logger log = LoggerFactory.getLogger(ParseSession.class);

    static final String START_LABEL = "Start";
    static final String STOP_LABEL = "Stop";
    private static final String STAR = "[*]";

    private record TransitionKey(String from, String to, String condition) {
    }

    private final List<SourceLine> lines;
    private final SyntheticIds ids = new SyntheticIds();

    private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
    private final Map<String, String> nodeIdByLabel = new HashMap<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final Set<TransitionKey> transitionKeys = new HashSet<>();
    private final List<StartPoint> startPoints = new ArrayList<>();

    private final Deque<BranchFrame> branchStack = new ArrayDeque<>();
    private final Deque<LoopFrame> loopStack = new ArrayDeque<>();

    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
    private final Map<String, String> skinparams = new LinkedHashMap<>();
    private final List<DiagramProperties.Pragma> pragmas = new ArrayList<>();
    private final List<String> styleBlocks = new ArrayList<>();
    private String title;

    private String currentNodeId;
    private SourceLine line;
    private int index;

    ParseSession(List<SourceLine> lines) {
        this.lines = lines;
    }

    void run() {
        for (index = 0; index < lines.size(); index++) {
            line = lines.get(index);
            handle(line.text());
        }
        closeFramesDeeperThan(-1);
    }

    ParseResult result(String definitionId, String definitionName, String defaultName) {
        if (nodes.isEmpty()) {
            throw new WorkflowParseException("Document contains no workflow nodes", diagnostics);
        }
        String id = definitionId != null ? definitionId : UUID.randomUUID().toString();
        String name = definitionName != null ? definitionName : title != null ? title : defaultName;
        WorkflowDefinition definition = new WorkflowDefinition(
                id, name, new ArrayList<>(nodes.values()), transitions, startPoints);
        return new ParseResult(definition, diagnostics,
                new DiagramProperties(skinparams, pragmas, styleBlocks, title));
    }

    // --- statement dispatch ---

    private void handle(String text) {
        Matcher m;
        if (STYLE_OPEN.matcher(text).matches()) {
            readStyleBlock();
        } else if ((m = SKINPARAM_BLOCK.matcher(text)).matches()) {
            readSkinparamBlock(m.group(1));
        } else if ((m = SKINPARAM.matcher(text)).matches()) {
            skinparams.put(m.group(1).trim(), m.group(2).trim());
        } else if ((m = PRAGMA.matcher(text)).matches()) {
            pragmas.add(new DiagramProperties.Pragma(m.group(1).trim(), m.group(2) != null ? m.group(2).trim() : null));
        } else if ((m = TITLE.matcher(text)).matches()) {
            title = m.group(1).trim();
        } else if ((m = NOTE_SHORTHAND.matcher(text)).matches()) {
            attachNote(null, m.group(1).trim());
        } else if ((m = NOTE_INLINE.matcher(text)).matches()) {
            attachNote(m.group(1).trim(), m.group(2).trim());
        } else if ((m = NOTE_BLOCK.matcher(text)).matches()) {
            readNoteBlock(m.group(1));
        } else if (START.matcher(text).matches()) {
            onStart();
        } else if (STOP.matcher(text).matches()) {
            onStop();
        } else if ((m = IF.matcher(text)).matches()) {
            onIf(m.group(1).trim(), firstPresent(m.group(4), m.group(2), m.group(3)));
        } else if ((m = ELSE_IF.matcher(text)).matches()) {
            onElse(m.group(1).trim(), firstPresent(m.group(4), m.group(2), m.group(3)));
        } else if ((m = ELSE.matcher(text)).matches()) {
            onElse("else", firstPresent(m.group(1)));
        } else if (END_IF.matcher(text).matches()) {
            onEndIf();
        } else if ((m = REPEAT_WHILE.matcher(text)).matches()) {
            onRepeatWhile(m.group(1).trim());
        } else if ((m = REPEAT.matcher(text)).matches()) {
            onRepeat(m.group(1));
        } else if ((m = ARROW.matcher(text)).matches() && isArrow(text, m)) {
            onArrow(m.group(1), m.group(2), m.group(3));
        } else if ((m = ACTION.matcher(text)).matches()) {
            onAction(m.group(2));
        } else {
            diagnose(ParseDiagnostic.Kind.UNRECOGNIZED, "Unrecognized statement skipped");
        }
    }

    /** An action label may itself contain an arrow token; it is an arrow only when the token follows the action's {@code ;}. */
    private static boolean isArrow(String text, Matcher arrow) {
        if (!text.startsWith(":")) return true;
        int semicolon = text.indexOf(';');
        return semicolon >= 0 && semicolon < arrow.start(2);
    }

    // --- side channel ---

    private void readStyleBlock() {
        int start = index;
        List<String> block = new ArrayList<>();
        int j = index;
        boolean closed = false;
        for (; j < lines.size(); j++) {
            block.add(lines.get(j).text());
            if (STYLE_CLOSE.matcher(lines.get(j).text()).matches()) {
                closed = true;
                break;
            }
        }
        styleBlocks.add(String.join("\n", block));
        if (!closed) {
            diagnose(lines.get(start), ParseDiagnostic.Kind.AUTO_CLOSED, "Style block not terminated by </style>");
        }
        index = Math.min(j, lines.size() - 1);
    }

    private void readSkinparamBlock(String group) {
        int j = index + 1;
        for (; j < lines.size(); j++) {
            SourceLine entry = lines.get(j);
            if (BLOCK_END.matcher(entry.text()).matches()) break;
            Matcher m = SKINPARAM_ENTRY.matcher(entry.text());
            if (m.matches()) {
                skinparams.put(group + "." + m.group(1).trim(), m.group(2).trim());
            } else {
                diagnose(entry, ParseDiagnostic.Kind.UNRECOGNIZED, "Unrecognized skinparam entry skipped");
            }
        }
        if (j >= lines.size()) {
            diagnose(ParseDiagnostic.Kind.AUTO_CLOSED, "Skinparam block not terminated by }");
        }
        index = Math.min(j, lines.size() - 1);
    }

    // --- notes ---

    private void readNoteBlock(String targetRaw) {
        SourceLine opener = line;
        List<String> body = new ArrayList<>();
        int j = index + 1;
        boolean closed = false;
        for (; j < lines.size(); j++) {
            if (NOTE_END.matcher(lines.get(j).text()).matches()) {
                closed = true;
                break;
            }
            body.add(lines.get(j).text());
        }
        index = Math.min(j, lines.size() - 1);
        if (!closed) {
            diagnose(opener, ParseDiagnostic.Kind.AUTO_CLOSED, "Note block not terminated by end note");
        }
        String target = targetRaw != null ? targetRaw.trim() : null;
        if (target != null && target.regionMatches(true, 0, "as ", 0, 3)) {
            log.debug("Floating note skipped | line={} | alias={}", opener.number(), target.substring(3).trim());
            return;
        }
        attachNote(target, String.join("\n", body).trim());
    }

    private void attachNote(String targetRaw, String text) {
        if (text.isEmpty()) return;
        String targetId;
        if (targetRaw == null || targetRaw.isEmpty()) {
            if (currentNodeId == null) {
                diagnose(ParseDiagnostic.Kind.MISPLACED_KEYWORD, "Note has no node to attach to");
                return;
            }
            targetId = currentNodeId;
        } else {
            targetId = resolveNode(targetRaw);
            if (targetId == null) {
                diagnose(ParseDiagnostic.Kind.UNRECOGNIZED, "Note target is empty");
                return;
            }
        }
        NoteText note = NoteText.split(text);
        if (note.invalidMetadata()) {
            diagnose(ParseDiagnostic.Kind.INVALID_METADATA, "Metadata before | is not a JSON object; kept as note text");
        }
        WorkflowNode node = nodes.get(targetId);
        String markdown = appendNote(node.getNoteMarkdown(), note.markdown());
        nodes.put(targetId, note.jsonMetadata() != null
                ? node.withMetadata(note.jsonMetadata(), markdown)
                : node.withNote(markdown));
    }

    private static String appendNote(String existing, String addition) {
        if (addition == null || addition.isEmpty()) return existing;
        if (existing == null || existing.isEmpty()) return addition;
        return existing + "\n" + addition;
    }

    // --- start / stop ---

    private void onStart() {
        String startId = resolveNode(START_LABEL);
        addStartPoint(startId);
        currentNodeId = startId;
    }

    private void onStop() {
        String stopId = resolveNode(STOP_LABEL);
        if (currentNodeId != null) {
            link(currentNodeId, stopId, null);
        }
        currentNodeId = stopId;
    }

    private void addStartPoint(String nodeId) {
        for (StartPoint sp : startPoints) {
            if (sp.nodeId().equals(nodeId)) return;
        }
        startPoints.add(new StartPoint(nodeId));
    }

    // --- branches ---

    private void onIf(String condition, String label) {
        String decisionId = createSyntheticNode(() -> ids.decisionId(condition), "if: " + condition);
        if (currentNodeId != null) {
            link(currentNodeId, decisionId, null);
        }
        branchStack.push(new BranchFrame(decisionId, condition, label, openDepth(), line));
        currentNodeId = decisionId;
    }

    private void onElse(String condition, String label) {
        BranchFrame frame = branchStack.peek();
        if (frame == null) {
            diagnose(ParseDiagnostic.Kind.MISPLACED_KEYWORD, "else without an open if");
            return;
        }
        closeFramesDeeperThan(frame.depth());
        frame.openBranch(label, condition, currentNodeId);
        currentNodeId = frame.decisionNodeId();
    }

    private void onEndIf() {
        BranchFrame frame = branchStack.peek();
        if (frame == null) {
            diagnose(ParseDiagnostic.Kind.MISPLACED_KEYWORD, "endif without an open if");
            return;
        }
        closeFramesDeeperThan(frame.depth());
        closeBranchFrame();
    }

    private void closeBranchFrame() {
        BranchFrame frame = branchStack.pop();
        frame.freezeActiveBranch(currentNodeId);
        String joinId = createSyntheticNode(ids::joinId, "join");
        for (BranchRecord branch : frame.branches()) {
            if (branch.isEmpty()) {
                addTransition(frame.decisionNodeId(), joinId, branch.conditionText());
            } else {
                addTransition(branch.exitNodeId(), joinId, null);
            }
        }
        currentNodeId = joinId;
    }

    // --- loops ---

    private void onRepeat(String firstActionLabel) {
        String loopEntryId = createSyntheticNode(ids::loopEntryId, "loop_entry");
        if (currentNodeId != null) {
            link(currentNodeId, loopEntryId, null);
        }
        loopStack.push(new LoopFrame(loopEntryId, openDepth(), line));
        currentNodeId = loopEntryId;
        if (firstActionLabel != null && !firstActionLabel.isBlank()) {
            onAction(firstActionLabel);
        }
    }

    private void onRepeatWhile(String condition) {
        LoopFrame frame = loopStack.peek();
        if (frame == null) {
            diagnose(ParseDiagnostic.Kind.MISPLACED_KEYWORD, "repeat while without an open repeat");
            return;
        }
        closeFramesDeeperThan(frame.depth());
        closeLoopFrame(condition);
    }

    private void closeLoopFrame(String condition) {
        LoopFrame frame = loopStack.pop();
        frame.close(condition, currentNodeId);
        String afterLoopId = createSyntheticNode(ids::afterLoopId, "after_loop");
        if (frame.hasBody()) {
            addTransition(frame.lastNodeId(), frame.loopEntryNodeId(), condition);
            addTransition(frame.lastNodeId(), afterLoopId, null);
        } else {
            addTransition(frame.loopEntryNodeId(), afterLoopId, null);
        }
        currentNodeId = afterLoopId;
    }

    // --- frame bookkeeping ---

    private int openDepth() {
        return branchStack.size() + loopStack.size();
    }

    private OpenFrame innermostFrame() {
        BranchFrame branch = branchStack.peek();
        LoopFrame loop = loopStack.peek();
        if (branch == null) return loop;
        if (loop == null) return branch;
        return branch.depth() > loop.depth() ? branch : loop;
    }

    /** Force-closes open frames nested deeper than {@code depth}, innermost first. */
    private void closeFramesDeeperThan(int depth) {
        OpenFrame inner;
        while ((inner = innermostFrame()) != null && inner.depth() > depth) {
            if (inner instanceof BranchFrame) {
                diagnose(inner.openedAt(), ParseDiagnostic.Kind.AUTO_CLOSED, "if closed without endif");
                closeBranchFrame();
            } else {
                diagnose(inner.openedAt(), ParseDiagnostic.Kind.AUTO_CLOSED, "repeat closed without repeat while");
                closeLoopFrame(null);
            }
        }
    }

    // --- arrows and actions ---

    private void onArrow(String leftRaw, String arrow, String rightRaw) {
        String left = EDGE_LABEL_QUOTED.matcher(leftRaw).replaceAll("").trim();
        String right = EDGE_LABEL_QUOTED.matcher(rightRaw).replaceAll("").trim();
        String guard = null;
        Matcher g = EDGE_GUARD.matcher(right);
        if (g.matches()) {
            guard = g.group(1).trim();
            right = g.group(2).trim();
        }
        boolean reverse = arrow.startsWith("<");
        String from = reverse ? right : left;
        String to = reverse ? left : right;
        if (normalizeLabel(from).isEmpty() || normalizeLabel(to).isEmpty() || (STAR.equals(from) && STAR.equals(to))) {
            diagnose(ParseDiagnostic.Kind.UNRECOGNIZED, "Arrow without both endpoints skipped");
            return;
        }
        if (STAR.equals(from)) {
            String targetId = resolveNode(to);
            addStartPoint(targetId);
            currentNodeId = targetId;
            return;
        }
        String fromId = resolveNode(from);
        String toId = STAR.equals(to) ? resolveNode(STOP_LABEL) : resolveNode(to);
        link(fromId, toId, guard);
        currentNodeId = toId;
    }

    private void onAction(String rawLabel) {
        List<String> stereotypes = new ArrayList<>();
        Matcher s = STEREOTYPE.matcher(rawLabel);
        while (s.find()) {
            stereotypes.add(s.group(1));
        }
        String label = normalizeLabel(STEREOTYPE.matcher(rawLabel).replaceAll(""));
        if (label.isEmpty()) {
            diagnose(ParseDiagnostic.Kind.UNRECOGNIZED, "Action without a label skipped");
            return;
        }
        String nodeId = resolveNode(label);
        if (currentNodeId != null) {
            link(currentNodeId, nodeId, null);
        }
        currentNodeId = nodeId;
        for (String stereotype : stereotypes) {
            WorkflowNode node = nodes.get(nodeId);
            String suffix = "<<" + stereotype + ">>";
            String note = node.getNoteMarkdown();
            if (note == null || !note.contains(suffix)) {
                nodes.put(nodeId, node.withNote(appendNote(note, suffix)));
            }
        }
    }

    // --- graph construction ---

    /**
     * Adds a transition, applying the linking rule: the first transition out of the innermost open
     * {@code if}'s decision node in a branch carries that branch's condition and becomes the branch
     * entry; the first transition out of an open loop's entry node marks the body's first node.
     */
    private void link(String fromId, String toId, String condition) {
        OpenFrame inner = innermostFrame();
        if (inner instanceof BranchFrame frame
                && fromId.equals(frame.decisionNodeId()) && frame.activeBranch().isEmpty()) {
            BranchRecord branch = frame.activeBranch();
            addTransition(fromId, toId, condition != null ? condition : branch.conditionText());
            branch.setEntryNodeId(toId);
            return;
        }
        if (inner instanceof LoopFrame frame
                && fromId.equals(frame.loopEntryNodeId()) && frame.firstNodeId() == null) {
            frame.setFirstNodeId(toId);
        }
        addTransition(fromId, toId, condition);
    }

    private boolean addTransition(String fromId, String toId, String condition) {
        if (fromId == null || toId == null) return false;
        String guard = condition == null || condition.isBlank() ? null : condition;
        if (fromId.equals(toId) && guard == null) {
            diagnose(ParseDiagnostic.Kind.SELF_TRANSITION_DROPPED, "Unconditioned self-transition on " + fromId + " dropped");
            return false;
        }
        if (!transitionKeys.add(new TransitionKey(fromId, toId, guard))) {
            diagnose(ParseDiagnostic.Kind.DUPLICATE_TRANSITION, "Duplicate transition " + fromId + " -> " + toId + " dropped");
            return false;
        }
        transitions.add(new Transition(ids.transitionId(), fromId, toId, guard));
        return true;
    }

    /** Finds a non-synthetic node by label, creating it when missing. Returns null for an empty label. */
    private String resolveNode(String token) {
        String label = normalizeLabel(token);
        if (label.isEmpty()) return null;
        String existing = nodeIdByLabel.get(label);
        if (existing != null) return existing;
        String id = nodes.containsKey(label) ? uniqueId(() -> ids.nodeId(label)) : label;
        nodes.put(id, new WorkflowNode(id, label));
        nodeIdByLabel.put(label, id);
        return id;
    }

    private String createSyntheticNode(Supplier<String> idSupplier, String label) {
        String id = uniqueId(idSupplier);
        nodes.put(id, new WorkflowNode(id, label));
        return id;
    }

    private String uniqueId(Supplier<String> idSupplier) {
        String id;
        do {
            id = idSupplier.get();
        } while (nodes.containsKey(id));
        return id;
    }

    static String normalizeLabel(String raw) {
        if (raw == null) return "";
        String label = raw.trim();
        if (label.startsWith(":")) label = label.substring(1).trim();
        if (label.endsWith(";")) label = label.substring(0, label.length() - 1).trim();
        return label;
    }

    private static String firstPresent(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isBlank()) return c.trim();
        }
        return null;
    }

    // --- diagnostics ---

    private void diagnose(ParseDiagnostic.Kind kind, String message) {
        diagnose(line, kind, message);
    }

    private void diagnose(SourceLine at, ParseDiagnostic.Kind kind, String message) {
        ParseDiagnostic diagnostic = at != null
                ? new ParseDiagnostic(at.number(), kind, message, at.text())
                : new ParseDiagnostic(0, kind, message, "");
        diagnostics.add(diagnostic);
        log.debug("Parse diagnostic | {}", diagnostic);
    }
}

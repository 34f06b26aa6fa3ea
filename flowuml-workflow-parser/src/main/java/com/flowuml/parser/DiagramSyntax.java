package com.flowuml.parser;

import java.util.regex.Pattern;

/** Statement patterns of the activity-diagram grammar. Keywords match case-insensitively. */
final class DiagramSyntax {

    private static final int CI = Pattern.CASE_INSENSITIVE;

    static final Pattern STYLE_OPEN = Pattern.compile("^<style\\b.*", CI);
    static final Pattern STYLE_CLOSE = Pattern.compile(".*</style>.*", CI);

    static final Pattern SKINPARAM_BLOCK = Pattern.compile("^skinparam\\s+([^\\s{]+)\\s*\\{$", CI);
    static final Pattern SKINPARAM = Pattern.compile("^skinparam\\s+(\\S+)\\s+(.*?);?$", CI);
    static final Pattern SKINPARAM_ENTRY = Pattern.compile("^(\\S+)\\s+(.*?);?$");
    static final Pattern BLOCK_END = Pattern.compile("^}$");

    static final Pattern PRAGMA = Pattern.compile("^!\\s*pragma\\s+(\\S+)(?:\\s+(.*))?$", CI);
    static final Pattern TITLE = Pattern.compile("^title\\s+(.+)$", CI);

    private static final String DIRECTION = "(?:left|right|top|bottom)";
    static final Pattern NOTE_SHORTHAND = Pattern.compile("^note(?:\\s+" + DIRECTION + ")?\\s*:\\s*(.*)$", CI);
    static final Pattern NOTE_INLINE = Pattern.compile(
            "^note(?:\\s+" + DIRECTION + ")?\\s+(?:of\\s+)?(.+?)\\s*:\\s*(.*)$", CI);
    static final Pattern NOTE_BLOCK = Pattern.compile(
            "^note(?:\\s+" + DIRECTION + ")?(?:\\s+(?:of\\s+)?(.+?))?\\s*;?$", CI);
    static final Pattern NOTE_END = Pattern.compile("^end\\s?note;?$", CI);

    static final Pattern START = Pattern.compile("^start;?$", CI);
    static final Pattern STOP = Pattern.compile("^(?:stop|end);?$", CI);

    static final Pattern IF = Pattern.compile(
            "^if\\s*\\((.*?)\\)\\s*(?:is\\s*\\((.*?)\\)\\s*|equals\\s*\\((.*?)\\)\\s*)?then(?:\\s*\\((.*?)\\))?;?$", CI);
    static final Pattern ELSE_IF = Pattern.compile(
            "^else\\s*if\\s*\\((.*?)\\)\\s*(?:is\\s*\\((.*?)\\)\\s*|equals\\s*\\((.*?)\\)\\s*)?then(?:\\s*\\((.*?)\\))?;?$", CI);
    static final Pattern ELSE = Pattern.compile("^else(?:\\s*\\((.*?)\\))?;?$", CI);
    static final Pattern END_IF = Pattern.compile("^end\\s?if;?$", CI);

    static final Pattern REPEAT = Pattern.compile("^repeat(?:\\s*:(.*?))?;?$", CI);
    static final Pattern REPEAT_WHILE = Pattern.compile(
            "^repeat\\s*while\\s*\\((.*?)\\)(?:\\s*is\\s*\\((.*?)\\))?(?:\\s*not\\s*\\((.*?)\\))?;?$", CI);

    static final Pattern ARROW = Pattern.compile("^(.*?)\\s*(<-{1,2}|-{1,2}>)\\s*(.*)$");
    static final Pattern EDGE_LABEL_QUOTED = Pattern.compile("\"[^\"]*\"");
    /** {@code [guard]} directly after the arrow token; {@code [*]} is an endpoint, not a guard. */
    static final Pattern EDGE_GUARD = Pattern.compile("^\\[(?!\\*\\])([^\\]]*)\\]\\s*(.*)$");

    static final Pattern ACTION = Pattern.compile("^(?:#([^:\\s]+)\\s*)?:(.*?);?$");
    static final Pattern STEREOTYPE = Pattern.compile("<<\\s*(\\w+)\\s*>>");

    private DiagramSyntax() {
    }
}

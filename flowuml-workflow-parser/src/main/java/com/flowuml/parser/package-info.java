/**
 * Activity-diagram compiler.
 * <p>
 * {@link com.flowuml.parser.ActivityDiagramParser} turns document text into a
 * {@link com.flowuml.model.WorkflowDefinition}: actions and arrows become nodes and transitions,
 * {@code if}/{@code else}/{@code endif} become a decision node, guarded branch entries and a join
 * node, and {@code repeat}/{@code repeat while} become a loop entry, a guarded back edge and an
 * exit node. Notes attach text to nodes; a note of the form {@code {json}|text} also attaches
 * embedded action metadata. Skinparams, pragmas, style blocks and the title are collected in
 * {@link com.flowuml.parser.DiagramProperties} and do not affect the graph.
 */
package com.flowuml.parser;

/**
 * Compiled workflow graph and its derived state payloads.
 *
 * <ul>
 *   <li>{@link com.flowuml.model.WorkflowDefinition} – nodes, transitions and start points; enforces referential integrity</li>
 *   <li>{@link com.flowuml.model.WorkflowNode}, {@link com.flowuml.model.Transition}, {@link com.flowuml.model.StartPoint} – immutable graph values</li>
 *   <li>{@link com.flowuml.model.WorkflowStatePayload}, {@link com.flowuml.model.ChoiceOption} – what the UI layer renders for a node</li>
 *   <li>{@link com.flowuml.model.json.WorkflowDefinitionJson} – {@code fromJson}/{@code toJson} for external repositories</li>
 *   <li>{@link com.flowuml.model.json.JsonObjects} – tagged "is this a JSON object" parsing for notes and metadata</li>
 * </ul>
 */
package com.flowuml.model;

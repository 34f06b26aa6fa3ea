/**
 * Named actions attached to workflow nodes.
 *
 * <ul>
 *   <li>{@link com.flowuml.action.WorkflowActionHandler} – contract: run with resolved params, return variable updates</li>
 *   <li>{@link com.flowuml.action.ActionHandlerRegistry} – name → handler, case-insensitive; ServiceLoader discovery</li>
 *   <li>{@link com.flowuml.action.ActionHandlerProvider} – SPI for discovered handlers</li>
 *   <li>{@link com.flowuml.action.ActionDescriptor} – {@code {"action":..., "params":{...}}} read from a node</li>
 *   <li>{@link com.flowuml.action.TemplateResolver} – {@code {{variable}}} substitution</li>
 * </ul>
 */
package com.flowuml.action;

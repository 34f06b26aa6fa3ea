/**
 * Workflow runtime: {@link com.flowuml.engine.WorkflowEngine} ties the parser, the definition store,
 * the instance manager and action dispatch together; {@link com.flowuml.engine.WorkflowStateCalculator}
 * derives start nodes and renderable payloads.
 */
package com.flowuml.engine;

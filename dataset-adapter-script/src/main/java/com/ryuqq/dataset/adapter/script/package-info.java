/**
 * Line-oriented script driver.
 *
 * <p>Reads a set-definition block followed by an operation block and turns each
 * line into a {@link com.ryuqq.dataset.application.registry.SetRegistry} call.
 * One failing command never stops the rest of the script.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dataset.adapter.script.ScriptParser} - Stateless line parsing</li>
 *   <li>{@link com.ryuqq.dataset.adapter.script.ScriptRunner} - Block handling, dispatch, fault isolation</li>
 *   <li>{@link com.ryuqq.dataset.adapter.script.ResultRenderer} - Output formatting</li>
 *   <li>{@link com.ryuqq.dataset.adapter.script.ScriptMain} - Command-line entry point</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DataSet Team
 */
package com.ryuqq.dataset.adapter.script;

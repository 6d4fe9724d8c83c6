/**
 * Pool-scoped configuration engine.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.poolscope.engine.ScopedConfig} loads and saves typed records per pool scope.</li>
 *   <li>{@code io.poolscope.merge.StructuralMerger} layers a pool override over the base record.</li>
 *   <li>{@code io.poolscope.storage.SqliteScopeStore} is the persistent scope store.</li>
 *   <li>{@code io.poolscope.cli.PoolScopeCommand} administers raw scope entries.</li>
 * </ul>
 */
package io.poolscope;

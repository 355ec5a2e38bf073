/**
 * Live Config - configuration aggregated from several sources and kept current while they change.
 *
 * <p>Fragments from every source are merged into one key space, cross-references are resolved,
 * and one reconciliation loop per source keeps the merged view up to date and notifies observers
 * of changed keys.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.liveconfig.Config} - Public read/subscribe surface</li>
 *   <li>{@link fr.lapetina.liveconfig.LiveConfig} - Orchestrator running the reconciliation loops</li>
 *   <li>{@link fr.lapetina.liveconfig.Observer} - Callback for changes of one key</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (LiveConfig config = LiveConfig.builder()
 *         .source(new FileSource("config"))
 *         .source(new EnvSource("APP"))
 *         .build()) {
 *     config.load();
 *
 *     Duration timeout = config.value("http.timeout").asDuration();
 *     config.watch("log.level", (key, value) -> applyLevel(value.asString()));
 * }
 * }</pre>
 *
 * <h2>Change Semantics</h2>
 * <ul>
 *   <li>A cached value keeps its identity; updates replace its payload in place</li>
 *   <li>Observers fire only when the payload changes and keeps its type</li>
 *   <li>Watch failures are retried after a fixed delay; merge and resolve failures keep the last good state</li>
 * </ul>
 *
 * @see fr.lapetina.liveconfig.LiveConfig
 * @see fr.lapetina.liveconfig.domain.model.Value
 */
package fr.lapetina.liveconfig;

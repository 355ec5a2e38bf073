/**
 * Domain model of the configuration aggregator.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.liveconfig.domain.model.KeyValue} - Immutable raw fragment emitted by a source</li>
 *   <li>{@link fr.lapetina.liveconfig.domain.model.Value} - Live or not-found holder for one resolved value</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code KeyValue} is an immutable record. {@code Value} keeps its payload in an
 * {@code AtomicReference}, so a cached value may be read by any thread while a reconciliation
 * loop stores into it.
 */
package fr.lapetina.liveconfig.domain.model;

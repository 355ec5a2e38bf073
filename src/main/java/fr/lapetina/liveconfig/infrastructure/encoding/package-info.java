/**
 * Configuration formats.
 *
 * <p>Codecs are looked up by format name through
 * {@link fr.lapetina.liveconfig.infrastructure.encoding.CodecRegistry}. Built-in formats:
 * <ul>
 *   <li>{@code json} - Jackson</li>
 *   <li>{@code yaml}, {@code yml} - SnakeYAML with the safe constructor</li>
 *   <li>{@code properties} - {@link java.util.Properties}, dotted keys expanded to nested mappings</li>
 * </ul>
 */
package fr.lapetina.liveconfig.infrastructure.encoding;

/**
 * Production merged key space.
 *
 * <p>{@link fr.lapetina.liveconfig.infrastructure.reader.MapReader} decodes fragments with a
 * {@link fr.lapetina.liveconfig.domain.reader.Decoder} (default
 * {@link fr.lapetina.liveconfig.infrastructure.reader.FormatDecoder}), deep-merges them into one tree
 * and resolves it with a {@link fr.lapetina.liveconfig.domain.reader.Resolver} (default
 * {@link fr.lapetina.liveconfig.infrastructure.reader.PlaceholderResolver}).
 *
 * <h2>Addressing</h2>
 * <p>Keys are {@code .}-separated paths into nested mappings, e.g. {@code server.port}.
 *
 * <h2>Placeholders</h2>
 * <pre>
 * server:
 *   host: ${HOST:localhost}
 *   url: http://${server.host}:8080
 * </pre>
 */
package fr.lapetina.liveconfig.infrastructure.reader;

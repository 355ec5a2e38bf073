/**
 * Built-in configuration sources.
 *
 * <ul>
 *   <li>{@link fr.lapetina.liveconfig.infrastructure.source.FileSource} - a file or a directory of files,
 *       hot-reloaded through the file system watch service</li>
 *   <li>{@link fr.lapetina.liveconfig.infrastructure.source.EnvSource} - environment variables, optionally
 *       filtered by prefix</li>
 * </ul>
 */
package fr.lapetina.liveconfig.infrastructure.source;

/**
 * Contracts of the merged key space.
 *
 * <p>The orchestrator only depends on {@link fr.lapetina.liveconfig.domain.reader.Reader}.
 * {@link fr.lapetina.liveconfig.domain.reader.Decoder} and
 * {@link fr.lapetina.liveconfig.domain.reader.Resolver} are construction options of the
 * production reader.
 */
package fr.lapetina.liveconfig.domain.reader;

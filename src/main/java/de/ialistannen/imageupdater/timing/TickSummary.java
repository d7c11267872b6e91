package de.ialistannen.imageupdater.timing;

/**
 * What a single pass over all workloads did.
 *
 * @param checked the number of enabled workloads looked at
 * @param restarted the number of workloads restarted
 * @param rewritten the number of workloads whose stored state was rewritten without a restart
 * @param failed the number of workloads that could not be reconciled
 */
public record TickSummary(int checked, int restarted, int rewritten, int failed) {

}

/**
 * PairLedger source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.pairledger.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.pairledger.cli.PairLedgerCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.pairledger.runtime.AgentRunner} runs the claim, work, finalize cycle of one agent.</li>
 *   <li>{@code io.pairledger.storage.JsonFileLedgerStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.pairledger;

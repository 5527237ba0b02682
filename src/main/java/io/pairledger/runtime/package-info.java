/**
 * Runtime orchestration package.
 *
 * <p>{@link io.pairledger.runtime.AgentRunner} drives one agent through lock,
 * claim, work and finalize. {@link io.pairledger.runtime.LedgerAdmin} owns the
 * operator mutations and inspections used by the CLI.
 */
package io.pairledger.runtime;

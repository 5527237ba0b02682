package io.pairledger;

import io.pairledger.cli.PairLedgerCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = PairLedgerCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}

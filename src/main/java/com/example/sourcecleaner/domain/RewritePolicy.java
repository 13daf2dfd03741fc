package com.example.sourcecleaner.domain;

import java.util.Objects;

public record RewritePolicy(
        SafeSymbolRegistry eligibleImports,
        boolean removeAllUnusedImports,
        boolean removeUnusedVariables) {
    public RewritePolicy {
        Objects.requireNonNull(eligibleImports, "eligibleImports");
    }

    public boolean isEligible(String packageName) {
        return eligibleImports.contains(packageName);
    }

    public RewritePolicy withoutVariableRemoval() {
        return new RewritePolicy(eligibleImports, removeAllUnusedImports, false);
    }
}

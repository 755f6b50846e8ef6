package com.finhelm.reconcile.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import com.finhelm.reconcile.config.InvalidConfigurationException;
import com.finhelm.reconcile.model.AccountRecord;
import com.finhelm.reconcile.model.AccountType;
import com.finhelm.reconcile.model.MatchResult;
import com.finhelm.reconcile.model.MatchTier;
import com.finhelm.reconcile.model.ReconciliationReport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AccountMatcherTest {

    private final AccountMatcher matcher = new AccountMatcher();

    @Test
    void identicalAccountsMatchExactly() {
        AccountRecord cash = new AccountRecord("1000", "Cash", "Assets:Cash", AccountType.BANK);

        List<MatchResult> matches = matcher.findBestAccountMatches(List.of(cash), List.of(cash));

        assertThat(matches).singleElement().satisfies(match -> {
            assertThat(match.score()).isEqualTo(1.0d);
            assertThat(match.tier()).isEqualTo(MatchTier.EXACT);
            assertThat(match.matchFactors().codeScore()).isEqualTo(1.0d);
        });
    }

    @Test
    void exactNormalizedCodeClearsDefaultThresholdEvenWhenEverythingElseDiffers() {
        AccountRecord source = new AccountRecord("ACC-1000", "Cash", "", AccountType.BANK);
        AccountRecord target = new AccountRecord("acc1000", "Petty Money Box", "", AccountType.EXPENSE);

        List<MatchResult> matches = matcher.findBestAccountMatches(List.of(source), List.of(target));

        assertThat(matches).singleElement().satisfies(match -> {
            assertThat(match.score()).isGreaterThanOrEqualTo(0.95d);
            assertThat(match.target()).isSameAs(target);
            assertThat(match.matchFactors().typeScore()).isZero();
        });
    }

    @Test
    void dropsPairsBelowThreshold() {
        AccountRecord travel = new AccountRecord("5000", "Travel", "", AccountType.EXPENSE);
        AccountRecord rent = new AccountRecord("9999", "Office Rent", "", AccountType.EXPENSE);

        assertThat(matcher.findBestAccountMatches(List.of(travel), List.of(rent))).isEmpty();
        assertThat(matcher.findBestAccountMatches(List.of(travel), List.of(rent), MatchWeights.DEFAULT, 0.0d))
                .hasSize(1);
    }

    @Test
    void resultsAreSortedByDescendingScore() {
        AccountRecord cash = new AccountRecord("1000", "Cash", "", AccountType.BANK);
        AccountRecord receivable = new AccountRecord("1200", "Accounts Receivable", "", AccountType.ACCOUNTS_RECEIVABLE);
        List<AccountRecord> sources = List.of(
                new AccountRecord("1200", "Trade Debtors", "", AccountType.ACCOUNTS_RECEIVABLE),
                cash);

        List<MatchResult> matches = matcher.findBestAccountMatches(sources, List.of(receivable, cash));

        assertThat(matches).hasSize(2);
        assertThat(matches.get(0).source()).isSameAs(cash);
        assertThat(matches).extracting(MatchResult::score).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(matches).allSatisfy(match -> assertThat(match.score()).isBetween(0.9d, 1.0d));
    }

    @Test
    void tieKeepsFirstTarget() {
        AccountRecord source = new AccountRecord("2000", "Payables", "", AccountType.ACCOUNTS_PAYABLE);
        AccountRecord first = new AccountRecord("2000", "Payables", "", AccountType.ACCOUNTS_PAYABLE);
        AccountRecord second = new AccountRecord("2000", "Payables", "", AccountType.ACCOUNTS_PAYABLE);

        List<MatchResult> matches = matcher.findBestAccountMatches(List.of(source), List.of(first, second));

        assertThat(matches).singleElement().satisfies(match -> assertThat(match.target()).isSameAs(first));
    }

    @Test
    void relatedTypesEarnPartialTypeCredit() {
        AccountRecord bank = new AccountRecord("1000", "Cash", "", AccountType.BANK);
        AccountRecord receivable = new AccountRecord("1000", "Cash", "", AccountType.ACCOUNTS_RECEIVABLE);

        List<MatchResult> matches = matcher.findBestAccountMatches(List.of(bank), List.of(receivable));

        assertThat(matches).singleElement()
                .satisfies(match -> assertThat(match.matchFactors().typeScore()).isEqualTo(0.5d));
    }

    @Test
    void hierarchyComesFromFullNameSegments() {
        AccountRecord source = new AccountRecord("1100", "Checking", "Assets:Current/Checking", AccountType.BANK);
        AccountRecord sameParents = new AccountRecord("1100", "Checking", "assets / current / checking", AccountType.BANK);
        AccountRecord noParents = new AccountRecord("1100", "Checking", "Checking", AccountType.BANK);

        assertThat(AccountMatcher.parentSegments("Assets:Current/Checking")).containsExactly("Assets", "Current");
        assertThat(matcher.findBestAccountMatches(List.of(source), List.of(sameParents)))
                .singleElement()
                .satisfies(match -> assertThat(match.matchFactors().hierarchyScore()).isEqualTo(1.0d));
        assertThat(matcher.findBestAccountMatches(List.of(source), List.of(noParents)))
                .singleElement()
                .satisfies(match -> assertThat(match.matchFactors().hierarchyScore()).isZero());
    }

    @Test
    void hierarchyFallsBackToParentCodesWhenFullNameIsBlank() {
        AccountRecord sourceParent = new AccountRecord("1", "Assets", "", AccountType.BANK);
        AccountRecord sourceChild = new AccountRecord("1100", "Checking", "", AccountType.BANK, Optional.of("1"));
        AccountRecord targetParent = new AccountRecord("01", "Assets", "", AccountType.BANK);
        AccountRecord targetChild = new AccountRecord("1100", "Checking", "", AccountType.BANK, Optional.of("01"));

        List<MatchResult> matches = matcher.findBestAccountMatches(
                List.of(sourceParent, sourceChild), List.of(targetParent, targetChild));

        assertThat(matches)
                .filteredOn(match -> match.source() == sourceChild)
                .singleElement()
                .satisfies(match -> {
                    assertThat(match.target()).isSameAs(targetChild);
                    assertThat(match.matchFactors().hierarchyScore()).isEqualTo(1.0d);
                    assertThat(match.score()).isEqualTo(1.0d);
                });
    }

    @Test
    void reconcileReportsUnmatchedAccountsAndTierCounts() {
        AccountRecord cash = new AccountRecord("1000", "Cash", "", AccountType.BANK);
        AccountRecord receivable = new AccountRecord("1200", "Accounts Receivable", "", AccountType.ACCOUNTS_RECEIVABLE);
        AccountRecord misc = new AccountRecord("7777", "Misc", "", AccountType.OTHER);
        AccountRecord rent = new AccountRecord("6000", "Rent", "", AccountType.EXPENSE);

        ReconciliationReport report = matcher.reconcile(
                List.of(cash, receivable, misc),
                List.of(cash, receivable, rent),
                MatchWeights.DEFAULT,
                AccountMatcher.DEFAULT_THRESHOLD);

        assertThat(report.matches()).hasSize(2);
        assertThat(report.unmatchedSources()).containsExactly(misc);
        assertThat(report.unmatchedTargets()).containsExactly(rent);
        assertThat(report.matchRate()).isEqualTo(2.0d / 3.0d);
        assertThat(report.tierCounts())
                .containsEntry(MatchTier.EXACT, 2)
                .containsEntry(MatchTier.STRONG, 0)
                .containsEntry(MatchTier.WEAK, 0);
    }

    @Test
    void emptyOrNullInputsYieldNoMatches() {
        AccountRecord cash = new AccountRecord("1000", "Cash", "", AccountType.BANK);

        assertThat(matcher.findBestAccountMatches(null, List.of(cash))).isEmpty();
        assertThat(matcher.findBestAccountMatches(List.of(cash), List.of())).isEmpty();
        assertThat(matcher.reconcile(List.of(), List.of(cash), MatchWeights.DEFAULT, 0.9d).matchRate()).isZero();
    }

    @Test
    void rejectsInvalidWeightsAndThresholds() {
        AccountRecord cash = new AccountRecord("1000", "Cash", "", AccountType.BANK);

        assertThatThrownBy(() -> new MatchWeights(0.5d, 0.5d, 0.5d, 0.1d, 0.5d, 0.95d))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("sum to 1.0");
        assertThatThrownBy(() -> matcher.findBestAccountMatches(List.of(cash), List.of(cash), MatchWeights.DEFAULT, 1.5d))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> matcher.findBestAccountMatches(List.of(cash), List.of(cash), null, 0.9d))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void matchesThousandByThousandChartsWithinBudget() {
        List<AccountRecord> sources = new ArrayList<>();
        List<AccountRecord> targets = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            AccountType type = AccountType.values()[i % AccountType.values().length];
            sources.add(new AccountRecord(String.valueOf(10000 + i), "Account " + i, "Ledger:Group " + (i / 50) + ":Account " + i, type));
            targets.add(new AccountRecord(String.format("0%d", 10000 + i), "account " + i, "ledger/group " + (i / 50) + "/account " + i, type));
        }

        List<MatchResult> matches = assertTimeoutPreemptively(Duration.ofSeconds(30),
                () -> matcher.findBestAccountMatches(sources, targets));

        assertThat(matches).hasSize(1000);
        assertThat(matches).allSatisfy(match -> assertThat(match.tier()).isEqualTo(MatchTier.EXACT));
    }
}

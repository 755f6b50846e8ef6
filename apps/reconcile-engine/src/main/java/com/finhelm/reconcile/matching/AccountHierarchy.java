package com.finhelm.reconcile.matching;

import com.finhelm.reconcile.model.AccountRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parent/child view over a flat chart of accounts, linked through {@code parentCode}.
 * Codes are compared in normalized form. Accounts whose parent is missing, or whose parent chain
 * loops back on itself, are treated as roots.
 */
public final class AccountHierarchy {

    private final Map<String, AccountRecord> accountsByKey;
    private final Map<String, String> parentByKey;
    private final Map<String, List<String>> childrenByKey;

    private AccountHierarchy(Map<String, AccountRecord> accountsByKey, Map<String, String> parentByKey) {
        this.accountsByKey = accountsByKey;
        this.parentByKey = parentByKey;
        Map<String, List<String>> children = new LinkedHashMap<>();
        for (String key : accountsByKey.keySet()) {
            String parent = parentByKey.get(key);
            if (parent != null) {
                children.computeIfAbsent(parent, ignored -> new ArrayList<>()).add(key);
            }
        }
        this.childrenByKey = children;
    }

    public static AccountHierarchy of(List<AccountRecord> accounts) {
        Map<String, AccountRecord> byKey = new LinkedHashMap<>();
        if (accounts != null) {
            accounts.stream()
                    .filter(Objects::nonNull)
                    .forEach(account -> byKey.putIfAbsent(AccountCodeNormalizer.normalize(account.code()), account));
        }
        return new AccountHierarchy(Collections.unmodifiableMap(byKey), resolveParents(byKey));
    }

    public List<AccountRecord> roots() {
        return accountsByKey.entrySet().stream()
                .filter(entry -> !parentByKey.containsKey(entry.getKey()))
                .map(Map.Entry::getValue)
                .toList();
    }

    public Optional<AccountRecord> find(String code) {
        return Optional.ofNullable(accountsByKey.get(AccountCodeNormalizer.normalize(code)));
    }

    public List<AccountRecord> children(String code) {
        return childrenByKey.getOrDefault(AccountCodeNormalizer.normalize(code), List.of()).stream()
                .map(accountsByKey::get)
                .toList();
    }

    public List<AccountRecord> descendants(String code) {
        List<AccountRecord> descendants = new ArrayList<>();
        collectDescendants(AccountCodeNormalizer.normalize(code), descendants);
        return descendants;
    }

    /**
     * Names from the root down to (and including) the given account; empty when the code is unknown.
     */
    public List<String> pathTo(String code) {
        String key = AccountCodeNormalizer.normalize(code);
        if (!accountsByKey.containsKey(key)) {
            return List.of();
        }
        List<String> path = new ArrayList<>();
        String cursor = key;
        while (cursor != null) {
            path.add(0, accountsByKey.get(cursor).name());
            cursor = parentByKey.get(cursor);
        }
        return path;
    }

    public List<String> ancestorNames(String code) {
        List<String> path = pathTo(code);
        return path.isEmpty() ? path : path.subList(0, path.size() - 1);
    }

    private void collectDescendants(String key, List<AccountRecord> sink) {
        for (String child : childrenByKey.getOrDefault(key, List.of())) {
            sink.add(accountsByKey.get(child));
            collectDescendants(child, sink);
        }
    }

    private static Map<String, String> resolveParents(Map<String, AccountRecord> byKey) {
        Map<String, String> parents = new LinkedHashMap<>();
        byKey.forEach((key, account) -> account.parentCode()
                .map(AccountCodeNormalizer::normalize)
                .filter(parentKey -> !parentKey.isEmpty() && !parentKey.equals(key) && byKey.containsKey(parentKey))
                .ifPresent(parentKey -> parents.put(key, parentKey)));

        // cut the link of every node that can reach itself
        for (String key : new ArrayList<>(parents.keySet())) {
            Set<String> seen = new HashSet<>();
            seen.add(key);
            String cursor = parents.get(key);
            while (cursor != null) {
                if (!seen.add(cursor)) {
                    if (cursor.equals(key)) {
                        parents.remove(key);
                    }
                    break;
                }
                cursor = parents.get(cursor);
            }
        }
        return Collections.unmodifiableMap(parents);
    }
}

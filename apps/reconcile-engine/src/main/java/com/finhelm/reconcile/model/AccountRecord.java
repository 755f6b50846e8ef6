package com.finhelm.reconcile.model;

import java.util.Optional;

public record AccountRecord(
        String code,
        String name,
        String fullName,
        AccountType type,
        Optional<String> parentCode
) {
    public AccountRecord {
        code = code == null ? "" : code;
        name = name == null ? "" : name;
        fullName = fullName == null ? "" : fullName;
        type = type == null ? AccountType.OTHER : type;
        parentCode = parentCode == null ? Optional.empty() : parentCode.filter(value -> !value.isBlank());
    }

    public AccountRecord(String code, String name, String fullName, AccountType type) {
        this(code, name, fullName, type, Optional.empty());
    }

    public AccountRecord withParentCode(String newParentCode) {
        return new AccountRecord(code, name, fullName, type, Optional.ofNullable(newParentCode));
    }
}

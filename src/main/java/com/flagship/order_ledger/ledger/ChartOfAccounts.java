package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.ledger.Account.AccountSubType;
import com.flagship.order_ledger.ledger.Account.AccountType;
import lombok.Getter;

/**
 * Default chart of accounts created for every tenant.
 */
@Getter
public enum ChartOfAccounts {
    CASH("1000", "Cash", AccountType.ASSET, AccountSubType.CASH),
    BANK("1100", "Bank Account", AccountType.ASSET, AccountSubType.BANK),
    ACCOUNTS_RECEIVABLE("1200", "Accounts Receivable", AccountType.ASSET, null),
    ADVANCE_TO_SUPPLIERS("1230", "Advance to Suppliers", AccountType.ASSET, null),
    INVENTORY("1300", "Inventory", AccountType.ASSET, null),

    ACCOUNTS_PAYABLE("2000", "Accounts Payable", AccountType.LIABILITY, null),
    CUSTOMER_ADVANCE("2050", "Customer Advance Balance", AccountType.LIABILITY, null),
    ACCRUED_EXPENSES("2100", "Accrued Expenses", AccountType.LIABILITY, null),
    COD_FEE_PAYABLE("2200", "COD Fee Payable", AccountType.LIABILITY, null),

    OWNER_CAPITAL("3000", "Owner Capital", AccountType.EQUITY, null),
    OPENING_BALANCE("3001", "Opening Balance", AccountType.EQUITY, null),
    OWNER_DRAWINGS("3100", "Owner Drawings", AccountType.EQUITY, null),
    RETAINED_EARNINGS("3200", "Retained Earnings", AccountType.EQUITY, null),

    SALES_REVENUE("4000", "Sales Revenue", AccountType.INCOME, null),
    SALES_RETURNS("4100", "Sales Returns", AccountType.INCOME, null),
    SHIPPING_REVENUE("4200", "Shipping Revenue", AccountType.INCOME, null),
    OTHER_INCOME("4400", "Other Income", AccountType.INCOME, null),

    COST_OF_GOODS_SOLD("5000", "Cost of Goods Sold", AccountType.EXPENSE, null),
    SHIPPING_EXPENSE("5100", "Shipping Expense", AccountType.EXPENSE, null),
    COD_FEE_EXPENSE("5200", "COD Fee Expense", AccountType.EXPENSE, null),
    OTHER_EXPENSES("5800", "Other Expenses", AccountType.EXPENSE, null);

    private final String code;
    private final String accountName;
    private final AccountType accountType;
    private final AccountSubType subType;

    ChartOfAccounts(String code, String accountName, AccountType accountType, AccountSubType subType) {
        this.code = code;
        this.accountName = accountName;
        this.accountType = accountType;
        this.subType = subType;
    }
}

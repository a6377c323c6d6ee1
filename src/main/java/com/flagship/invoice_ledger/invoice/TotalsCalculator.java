package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.exception.InvalidDiscountException;
import com.flagship.invoice_ledger.exception.InvalidLineItemException;
import com.flagship.invoice_ledger.exception.InvalidRequestException;
import com.flagship.invoice_ledger.ledger.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Prices an invoice from its line items, discount and tax rate.
 *
 * Pure function of its inputs. Rounding is half-up to two decimals and is
 * applied at each step, in this order:
 * 1. line amount  = round(quantity * rate)
 * 2. subtotal     = sum of line amounts
 * 3. tax amount   = round((subtotal - discount) * taxRate / 100)
 * 4. total        = subtotal - discount + tax amount
 *
 * Tax is computed on the discounted base.
 *
 * Inputs must fit the stored columns exactly, so that repricing from stored rows
 * gives the same totals: quantity and rate carry at most four decimals, discount
 * and tax rate at most two.
 */
@Component
public class TotalsCalculator {

    public static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int ITEM_SCALE = 4;
    static final int RATE_PERCENT_SCALE = 2;

    public InvoiceTotals calculate(List<LineItem> items, BigDecimal discountAmount, BigDecimal taxRatePercent) {
        if (items == null || items.isEmpty()) {
            throw new InvalidLineItemException("An invoice needs at least one line item");
        }

        List<BigDecimal> lineAmounts = new ArrayList<>(items.size());
        BigDecimal subtotal = Money.ZERO;
        for (int i = 0; i < items.size(); i++) {
            BigDecimal amount = lineAmount(items.get(i), i);
            lineAmounts.add(amount);
            subtotal = subtotal.add(amount);
        }

        if (discountAmount != null && decimals(discountAmount) > Money.SCALE) {
            throw new InvalidDiscountException("Discount cannot have more than " + Money.SCALE + " decimals");
        }
        BigDecimal discount = Money.orZero(discountAmount);
        if (discount.signum() < 0) {
            throw new InvalidDiscountException("Discount cannot be negative");
        }
        if (discount.compareTo(subtotal) > 0) {
            throw new InvalidDiscountException(String.format(
                    "Discount %s exceeds subtotal %s", discount.toPlainString(), subtotal.toPlainString()));
        }

        BigDecimal taxRate = taxRatePercent == null ? BigDecimal.ZERO : taxRatePercent;
        if (taxRate.signum() < 0 || taxRate.compareTo(Money.HUNDRED) > 0) {
            throw new InvalidRequestException("Tax rate must be between 0 and 100 percent");
        }
        if (decimals(taxRate) > RATE_PERCENT_SCALE) {
            throw new InvalidRequestException("Tax rate cannot have more than " + RATE_PERCENT_SCALE + " decimals");
        }

        BigDecimal taxable = subtotal.subtract(discount);
        BigDecimal taxAmount = Money.round(taxable.multiply(taxRate).divide(Money.HUNDRED));
        BigDecimal total = taxable.add(taxAmount);

        return new InvoiceTotals(List.copyOf(lineAmounts), subtotal, discount, taxRate, taxAmount, total);
    }

    private BigDecimal lineAmount(LineItem item, int index) {
        if (item == null) {
            throw new InvalidLineItemException("Line item " + (index + 1) + " is missing");
        }
        if (item.getDescription() == null || item.getDescription().isBlank()) {
            throw new InvalidLineItemException("Line item " + (index + 1) + " needs a description");
        }
        if (item.getDescription().length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidLineItemException("Line item " + (index + 1) + " description exceeds "
                    + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (item.getQuantity() == null || item.getQuantity().signum() <= 0) {
            throw new InvalidLineItemException("Line item " + (index + 1) + " quantity must be positive");
        }
        if (item.getRate() == null || item.getRate().signum() < 0) {
            throw new InvalidLineItemException("Line item " + (index + 1) + " rate cannot be negative");
        }
        if (decimals(item.getQuantity()) > ITEM_SCALE || decimals(item.getRate()) > ITEM_SCALE) {
            throw new InvalidLineItemException("Line item " + (index + 1) + " quantity and rate allow at most "
                    + ITEM_SCALE + " decimals");
        }
        return Money.round(item.getQuantity().multiply(item.getRate()));
    }

    private static int decimals(BigDecimal value) {
        return Math.max(0, value.stripTrailingZeros().scale());
    }
}

package com.livemart.marketplace.config;

import com.livemart.marketplace.entity.FulfillmentIssueKind;
import com.livemart.marketplace.entity.OrderStatus;
import com.livemart.marketplace.entity.PaymentStatus;
import com.livemart.marketplace.entity.UserRole;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import java.util.List;

/**
 * Status and role enums are stored in their lowercase wire form ({@code "placed"}, {@code "pending"}),
 * the same strings the API returns, instead of the constant names.
 */
final class StoredValueConverters {

    private StoredValueConverters() {}

    static List<Converter<?, ?>> all() {
        return List.of(
                new OrderStatusWriter(), new OrderStatusReader(),
                new PaymentStatusWriter(), new PaymentStatusReader(),
                new UserRoleWriter(), new UserRoleReader(),
                new FulfillmentIssueKindWriter(), new FulfillmentIssueKindReader());
    }

    @WritingConverter
    static class OrderStatusWriter implements Converter<OrderStatus, String> {
        @Override
        public String convert(OrderStatus source) { return source.value(); }
    }

    @ReadingConverter
    static class OrderStatusReader implements Converter<String, OrderStatus> {
        @Override
        public OrderStatus convert(String source) { return OrderStatus.fromValue(source); }
    }

    @WritingConverter
    static class PaymentStatusWriter implements Converter<PaymentStatus, String> {
        @Override
        public String convert(PaymentStatus source) { return source.value(); }
    }

    @ReadingConverter
    static class PaymentStatusReader implements Converter<String, PaymentStatus> {
        @Override
        public PaymentStatus convert(String source) { return PaymentStatus.fromValue(source); }
    }

    @WritingConverter
    static class UserRoleWriter implements Converter<UserRole, String> {
        @Override
        public String convert(UserRole source) { return source.value(); }
    }

    @ReadingConverter
    static class UserRoleReader implements Converter<String, UserRole> {
        @Override
        public UserRole convert(String source) { return UserRole.fromValue(source); }
    }

    @WritingConverter
    static class FulfillmentIssueKindWriter implements Converter<FulfillmentIssueKind, String> {
        @Override
        public String convert(FulfillmentIssueKind source) { return source.value(); }
    }

    @ReadingConverter
    static class FulfillmentIssueKindReader implements Converter<String, FulfillmentIssueKind> {
        @Override
        public FulfillmentIssueKind convert(String source) { return FulfillmentIssueKind.fromValue(source); }
    }
}

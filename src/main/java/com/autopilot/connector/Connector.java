package com.autopilot.connector;

import com.autopilot.connector.model.ContactRecord;
import com.autopilot.connector.model.DealRecord;
import com.autopilot.connector.model.ExpenseRecord;
import com.autopilot.connector.model.InvoiceRecord;
import com.autopilot.connector.model.TaskRecord;

import java.util.List;
import java.util.Map;

/**
 * Контракт внешней системы тенанта (CRM, бухгалтерия, трекер задач).
 *
 * Реализации не бросают исключений и не делают повторов сами:
 * ошибка чтения - пустой список, ошибка записи - false.
 * Повторы записи выполняет {@link com.autopilot.action.service.ActionExecutor}.
 */
public interface Connector {

    String sourceName();

    boolean connect();

    default List<DealRecord> fetchDeals() {
        return List.of();
    }

    default List<InvoiceRecord> fetchInvoices() {
        return List.of();
    }

    default List<TaskRecord> fetchTasks() {
        return List.of();
    }

    default List<ContactRecord> fetchContacts() {
        return List.of();
    }

    default List<ExpenseRecord> fetchExpenses() {
        return List.of();
    }

    default boolean updateDeal(String dealId, Map<String, Object> fields) {
        return false;
    }

    default boolean addNote(String dealId, String note) {
        return false;
    }
}

package com.autopilot.scheduler.model;

/**
 * Что делает задача для каждого тенанта.
 */
public enum JobKind {
    /** запуск агента */
    AGENT,
    /** разбор очереди событий, для всех тенантов */
    ROUTER,
    /** еженедельный отчет руководителю */
    WEEKLY_REPORT,
    /** проверка и чтение подключенных инструментов перед запуском агентов */
    CONNECTOR_SYNC
}

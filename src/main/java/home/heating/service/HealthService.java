package home.heating.service;

import home.heating.enums.SelfMonitoringStatus;

public interface HealthService {
    /**
     * Последний рассчитанный статус селфмониторинга
     */
    SelfMonitoringStatus getLastStatus();

    /**
     * Расчет статуса селфмониторинга для бота
     *
     * @return строка со статусом
     */
    String getFormattedStatus();
}

package home.heating.service;

import home.heating.exception.ActuatorException;

/**
 * Физический ввод-вывод пинов. Реализация выбирается профилем: реле по modbus или симуляция.
 */
public interface RelayService {
    /**
     * Чтение текущего физического состояния реле пина
     *
     * @param pin имя пина
     * @return true если реле включено
     * @throws ActuatorException ошибка опроса реле
     */
    boolean readState(String pin) throws ActuatorException;

    /**
     * Запись состояния реле пина
     *
     * @param pin имя пина
     * @param on  новое состояние
     * @throws ActuatorException ошибка записи
     */
    void writeState(String pin, boolean on) throws ActuatorException;
}

package home.heating.service;

import home.heating.exception.ModbusException;

public interface ModbusService {
    /**
     * Чтение состояния одной катушки реле (F01)
     *
     * @param address modbus адрес реле
     * @param coilId  id катушки
     * @return состояние катушки
     */
    boolean readCoil(int address, int coilId) throws ModbusException;

    /**
     * Метод переключения состояния катушки (F05)
     *
     * @param address modbus адрес реле
     * @param coilId  id катушки
     * @param value   новое значение катушки
     */
    void writeCoil(int address, int coilId, boolean value) throws ModbusException;

    /**
     * Метод чтения состояния Holding Register (F03)
     *
     * @param address    modbus адрес
     * @param registerId id регистра
     * @return одиночное значение
     */
    int readHoldingRegister(int address, int registerId) throws ModbusException;
}

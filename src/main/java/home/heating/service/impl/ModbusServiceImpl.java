package home.heating.service.impl;

import com.intelligt.modbus.jlibmodbus.Modbus;
import com.intelligt.modbus.jlibmodbus.master.ModbusMaster;
import com.intelligt.modbus.jlibmodbus.master.ModbusMasterFactory;
import com.intelligt.modbus.jlibmodbus.tcp.TcpParameters;
import home.heating.configuration.ModbusConfiguration;
import home.heating.exception.ModbusException;
import home.heating.service.ModbusService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Все обращения к шине идут через один поток, после каждого запроса выдерживается пауза
 */
@Service
@Profile("!simulation")
public class ModbusServiceImpl implements ModbusService {
    private static final Logger logger = LoggerFactory.getLogger(ModbusServiceImpl.class);
    private final ModbusConfiguration modbusConfiguration;
    private final ExecutorService executorService = Executors.newSingleThreadExecutor();
    private ModbusMaster modbusMaster;

    public ModbusServiceImpl(ModbusConfiguration modbusConfiguration) {
        this.modbusConfiguration = modbusConfiguration;
        try {
            init();
        } catch (ModbusException e) {
            /* связи может не быть при запуске, переподключимся при первом запросе */
            logger.warn("Modbus недоступен при запуске, подключение будет повторено при первом запросе");
        }
    }

    private synchronized void init() throws ModbusException {
        try {
            if (modbusMaster == null) {
                TcpParameters tcpParameters = new TcpParameters();
                tcpParameters.setHost(InetAddress.getByName(modbusConfiguration.getHost()));
                tcpParameters.setKeepAlive(true);
                tcpParameters.setPort(modbusConfiguration.getPort());

                modbusMaster = ModbusMasterFactory.createModbusMasterTCP(tcpParameters);
                Modbus.setAutoIncrementTransactionId(true);
            }

            if (!modbusMaster.isConnected()) {
                modbusMaster.connect();
            }
        } catch (Exception e) {
            logger.error("Ошибка подключения к modbus {}:{}", modbusConfiguration.getHost(),
                modbusConfiguration.getPort(), e);
            throw new ModbusException("Нет связи с modbus");
        }
    }

    @Override
    public boolean readCoil(int address, int coilId) throws ModbusException {
        return execute("Ошибка чтения состояния катушки " + coilId + ", адрес " + address, () -> {
            boolean[] result = modbusMaster.readCoils(address, coilId, 1);
            if (result.length < 1) {
                throw new ModbusException("Опрос катушки вернул пустой массив");
            }
            return result[0];
        });
    }

    @Override
    public void writeCoil(int address, int coilId, boolean value) throws ModbusException {
        execute("Ошибка выставления значения катушки " + coilId + ", адрес " + address, () -> {
            modbusMaster.writeSingleCoil(address, coilId, value);
            return Boolean.TRUE;
        });
    }

    @Override
    public int readHoldingRegister(int address, int registerId) throws ModbusException {
        return execute("Ошибка чтения регистра " + registerId + ", адрес " + address,
            () -> modbusMaster.readHoldingRegisters(address, registerId, 1)[0]);
    }

    private <T> T execute(String errorMessage, Callable<T> operation) throws ModbusException {
        init();
        try {
            /* get нужен, чтобы получить ExecutionException и по нему понять, что запрос не прошел */
            return executorService.submit(() -> {
                try {
                    return operation.call();
                } finally {
                    delay();
                }
            }).get();
        } catch (ExecutionException e) {
            logger.error(errorMessage, e.getCause());
            throw new ModbusException(errorMessage);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModbusException(errorMessage);
        }
    }

    private void delay() throws InterruptedException {
        Thread.sleep(modbusConfiguration.getDelay());
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
        try {
            if (modbusMaster != null) {
                modbusMaster.disconnect();
            }
        } catch (Exception e) {
            logger.warn("Ошибка отключения от modbus", e);
        }
    }
}

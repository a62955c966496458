package home.heating;

import home.heating.configuration.HeatingConfiguration;
import home.heating.configuration.HeatingConfiguration.PinProperties;
import home.heating.exception.ActuatorException;
import home.heating.exception.ModbusException;
import home.heating.service.ModbusService;
import home.heating.service.impl.ModbusRelayServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModbusRelayServiceTest {
    private ModbusService modbusService;

    private ModbusRelayServiceImpl relayService;

    private static PinProperties pin(int address, int coil, boolean inverted) {
        PinProperties properties = new PinProperties();
        properties.setAddress(address);
        properties.setCoil(coil);
        properties.setInverted(inverted);
        return properties;
    }

    @BeforeEach
    void setUp() {
        HeatingConfiguration configuration = new HeatingConfiguration();
        configuration.getPins().put("CH", pin(2, 0, false));
        configuration.getPins().put("HW", pin(2, 1, true));
        modbusService = Mockito.mock(ModbusService.class);
        relayService = new ModbusRelayServiceImpl(configuration, modbusService);
    }

    @Test
    @DisplayName("Запись и чтение катушки с учетом инвертированного подключения")
    void checkInverted() throws ModbusException, ActuatorException {
        relayService.writeState("CH", true);
        relayService.writeState("HW", true);
        Mockito.verify(modbusService).writeCoil(2, 0, true);
        Mockito.verify(modbusService).writeCoil(2, 1, false);

        Mockito.when(modbusService.readCoil(2, 1)).thenReturn(false);
        assertTrue(relayService.readState("HW"));
        Mockito.when(modbusService.readCoil(2, 0)).thenReturn(false);
        assertFalse(relayService.readState("CH"));
    }

    @Test
    @DisplayName("Ошибка modbus превращается в ошибку реле")
    void checkModbusError() throws ModbusException {
        Mockito.when(modbusService.readCoil(2, 0)).thenThrow(new ModbusException("таймаут"));
        ActuatorException e = assertThrows(ActuatorException.class, () -> relayService.readState("CH"));
        assertEquals("CH", e.getPin());
        assertTrue(e.getCause() instanceof ModbusException);
    }

    @Test
    @DisplayName("Пин без настроек")
    void checkUnknownPin() {
        assertThrows(ActuatorException.class, () -> relayService.writeState("POOL", true));
    }
}

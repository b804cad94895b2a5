package com.flagship.solid_ledger.token;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.CurrencyNetwork;
import com.flagship.solid_ledger.chain.ManualBlockSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReserveKeeperTest {

    private final Address controller = Address.derive("controller");
    private final Address stranger = Address.derive("stranger");
    private final Address recipient = Address.derive("recipient");

    private CurrencyNetwork network;
    private Chain chain;
    private ReserveKeeper keeper;

    @BeforeEach
    void setUp() {
        chain = new Chain(new ManualBlockSource());
        network = new CurrencyNetwork(chain);
        network.credit(controller, BigInteger.valueOf(1_000));
        network.credit(stranger, BigInteger.valueOf(1_000));
        keeper = new ReserveKeeper(Address.derive("keeper"), controller, network);
    }

    @Test
    @DisplayName("Anyone may deposit, including through a plain send")
    void testDeposits() {
        chain.run(() -> keeper.deposit(stranger, BigInteger.valueOf(100)));
        assertTrue(network.send(controller, keeper.getAddress(), BigInteger.valueOf(50)));

        assertEquals(BigInteger.valueOf(150), keeper.reserveBalance());
    }

    @Test
    @DisplayName("Only the controller may withdraw")
    void testWithdrawAuthority() {
        chain.run(() -> keeper.deposit(stranger, BigInteger.valueOf(100)));

        LedgerException e = assertThrows(LedgerException.class,
            () -> chain.run(() -> keeper.withdraw(stranger, stranger, BigInteger.TEN)));
        assertEquals(ErrorCode.UNAUTHORIZED, e.getCode());

        chain.run(() -> keeper.withdraw(controller, recipient, BigInteger.TEN));
        assertEquals(BigInteger.valueOf(90), keeper.reserveBalance());
        assertEquals(BigInteger.TEN, network.balanceOf(recipient));
    }

    @Test
    @DisplayName("Withdrawing more than the reserve fails with INSUFFICIENT_RESERVE")
    void testInsufficientReserve() {
        chain.run(() -> keeper.deposit(stranger, BigInteger.valueOf(100)));

        LedgerException e = assertThrows(LedgerException.class,
            () -> chain.run(() -> keeper.withdraw(controller, recipient, BigInteger.valueOf(101))));

        assertEquals(ErrorCode.INSUFFICIENT_RESERVE, e.getCode());
        assertEquals(BigInteger.valueOf(100), keeper.reserveBalance());
    }

    @Test
    @DisplayName("A rejected payout keeps the reserve intact")
    void testRejectedPayout() {
        chain.run(() -> keeper.deposit(stranger, BigInteger.valueOf(100)));
        network.registerRecipient(recipient, (from, amount) -> {
            throw new IllegalStateException("refusing currency");
        });

        LedgerException e = assertThrows(LedgerException.class,
            () -> chain.run(() -> keeper.withdraw(controller, recipient, BigInteger.TEN)));

        assertEquals(ErrorCode.TRANSFER_FAILED, e.getCode());
        assertEquals(BigInteger.valueOf(100), keeper.reserveBalance());
        assertEquals(BigInteger.ZERO, network.balanceOf(recipient));
    }
}

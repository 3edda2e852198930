package io.scalex.bridge.token;

import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class MintableTokenTest {
    
    private static final String MINTER = "0x111";
    private static final String ALICE = "0xa11ce";
    private static final String BOB = "0xb0b";
    private static final String GATEWAY = "0x6a7e";
    
    private MintableToken token;
    
    @BeforeEach
    public void setUp() {
        token = new MintableToken("0x75faf114eafb1bdbe2f0316df893fd58ce46aa4d", "USD Coin", "USDC", 6, MINTER);
        token.mint(MINTER, ALICE, BigInteger.valueOf(1_000));
    }
    
    @Test
    public void testMintAndBurnOnlyByMinter() {
        BridgeException mint = assertThrows(BridgeException.class,
            () -> token.mint(ALICE, ALICE, BigInteger.ONE));
        assertEquals(BridgeErrorCode.UNAUTHORIZED, mint.getCode());
        
        BridgeException burn = assertThrows(BridgeException.class,
            () -> token.burn(BOB, ALICE, BigInteger.ONE));
        assertEquals(BridgeErrorCode.UNAUTHORIZED, burn.getCode());
        
        token.burn(MINTER, ALICE, BigInteger.valueOf(400));
        assertEquals(BigInteger.valueOf(600), token.balanceOf(ALICE));
        assertEquals(BigInteger.valueOf(600), token.totalSupply());
    }
    
    @Test
    public void testTransferFromNeedsAllowance() {
        BridgeException noAllowance = assertThrows(BridgeException.class,
            () -> token.transferFrom(GATEWAY, ALICE, GATEWAY, BigInteger.TEN));
        assertEquals(BridgeErrorCode.INSUFFICIENT_FUNDS, noAllowance.getCode());
        
        token.approve(ALICE, GATEWAY, BigInteger.valueOf(100));
        token.transferFrom(GATEWAY, ALICE, GATEWAY, BigInteger.valueOf(60));
        
        assertEquals(BigInteger.valueOf(940), token.balanceOf(ALICE));
        assertEquals(BigInteger.valueOf(60), token.balanceOf(GATEWAY));
        assertEquals(BigInteger.valueOf(40), token.allowance(ALICE, GATEWAY));
    }
    
    @Test
    public void testShortBalanceMovesNothing() {
        token.approve(ALICE, GATEWAY, BigInteger.valueOf(5_000));
        
        BridgeException e = assertThrows(BridgeException.class,
            () -> token.transferFrom(GATEWAY, ALICE, GATEWAY, BigInteger.valueOf(2_000)));
        assertEquals(BridgeErrorCode.INSUFFICIENT_FUNDS, e.getCode());
        assertEquals(BigInteger.valueOf(1_000), token.balanceOf(ALICE));
        assertEquals(BigInteger.valueOf(5_000), token.allowance(ALICE, GATEWAY));
    }
    
    @Test
    public void testNegativeAmountRejected() {
        BridgeException e = assertThrows(BridgeException.class,
            () -> token.transfer(ALICE, BOB, BigInteger.valueOf(-1)));
        assertEquals(BridgeErrorCode.INVALID_AMOUNT, e.getCode());
    }
}

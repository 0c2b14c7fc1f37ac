package com.chain.chainledgersystem.data.transaction;

import com.chain.chainledgersystem.exception.InvalidTransactionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TransactionTest {

    @Test
    void creationReportsEveryMissingField() {
        CreationTransaction tx = new CreationTransaction();
        tx.setItemId("EV-1");
        tx.setActor("A");
        InvalidTransactionException e = Assertions.assertThrows(InvalidTransactionException.class, tx::validate);
        Assertions.assertTrue(e.getMessage().contains("description"));
        Assertions.assertTrue(e.getMessage().contains("location"));
        Assertions.assertTrue(e.getMessage().contains("item_type"));
        Assertions.assertFalse(e.getMessage().contains("actor"));
    }

    @Test
    void transferRequiresBothActorsAndReason() {
        TransferTransaction tx = new TransferTransaction();
        tx.setItemId("EV-1");
        tx.setFromActor("A");
        tx.setToActor("  ");
        InvalidTransactionException e = Assertions.assertThrows(InvalidTransactionException.class, tx::validate);
        Assertions.assertTrue(e.getMessage().contains("to_actor"));
        Assertions.assertTrue(e.getMessage().contains("reason"));

        tx.setToActor("B");
        tx.setReason("lab");
        Assertions.assertDoesNotThrow(tx::validate);
        Assertions.assertEquals("item_transfer", tx.getType());
        Assertions.assertEquals("Transferred", tx.getAction());
    }

    @Test
    void itemIdIsAlwaysRequired() {
        CreationTransaction tx = new CreationTransaction();
        tx.setDescription("knife");
        tx.setActor("A");
        tx.setLocation("scene");
        tx.setItemType("Physical");
        InvalidTransactionException e = Assertions.assertThrows(InvalidTransactionException.class, tx::validate);
        Assertions.assertTrue(e.getMessage().contains("item_id"));
    }
}

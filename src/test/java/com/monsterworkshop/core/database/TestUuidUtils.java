package com.monsterworkshop.core.database;

import org.junit.Assert;
import org.junit.Test;

import java.util.UUID;

public class TestUuidUtils {

    @Test
    public void binaryColumnRoundTrip() {
        UUID id = UUID.fromString("00112233-4455-6677-8899-aabbccddeeff");
        byte[] bytes = UuidUtils.asBytes(id);
        Assert.assertEquals(16, bytes.length);
        Assert.assertEquals((byte) 0x00, bytes[0]);
        Assert.assertEquals((byte) 0xff, bytes[15]);
        Assert.assertEquals(id, UuidUtils.asUuid(bytes));
    }

    @Test
    public void missingValues() {
        Assert.assertNull(UuidUtils.asBytes(null));
        Assert.assertNull(UuidUtils.asUuid(null));
        Assert.assertNull(UuidUtils.asUuid(new byte[8]));
    }
}

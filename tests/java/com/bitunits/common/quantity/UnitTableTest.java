// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.bitunits.common.quantity;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class UnitTableTest {

  @Test
  public void testExactLookup() {
    for (SizeUnit unit : SizeUnit.values()) {
      assertSame(unit, UnitTable.SIZE.lookup(unit.symbol()));
    }
    for (RateUnit unit : RateUnit.values()) {
      assertSame(unit, UnitTable.RATE.lookup(unit.symbol()));
    }
  }

  @Test
  public void testCaseInsensitiveLookup() {
    assertSame(SizeUnit.MB, UnitTable.SIZE.lookup("mb"));
    assertSame(SizeUnit.kB, UnitTable.SIZE.lookup("KB"));
    assertSame(SizeUnit.B, UnitTable.SIZE.lookup("b"));
    assertTrue(UnitTable.SIZE.contains("gb"));
  }

  @Test
  public void testAmbiguousRateSymbolsFollowTheB() {
    assertSame(RateUnit.Mbps, UnitTable.RATE.lookup("mbps"));
    assertSame(RateUnit.Mbps, UnitTable.RATE.lookup("MbPS"));
    assertSame(RateUnit.MBps, UnitTable.RATE.lookup("MBPS"));
    assertSame(RateUnit.MBps, UnitTable.RATE.lookup("mBps"));
    assertSame(RateUnit.kbps, UnitTable.RATE.lookup("Kbps"));
    assertSame(RateUnit.Bps, UnitTable.RATE.lookup("BPS"));
    assertSame(RateUnit.bps, UnitTable.RATE.lookup("bPS"));
  }

  @Test
  public void testUnknownSymbol() {
    assertFalse(UnitTable.SIZE.contains("XB"));
    try {
      UnitTable.SIZE.lookup("XB");
      fail("expected XB to be rejected");
    } catch (UnknownUnitException e) {
      assertEquals("XB", e.getSymbol());
    }
  }

  @Test(expected = UnknownUnitException.class)
  public void testFamiliesAreSeparate() {
    UnitTable.RATE_BITS.lookup("MBps");
  }

  @Test
  public void testOrdering() {
    assertSame(SizeUnit.YB, UnitTable.SIZE.descending().get(0));
    assertSame(SizeUnit.B, UnitTable.SIZE.base());
    assertSame(RateUnit.Ybps, UnitTable.RATE_BITS.descending().get(0));
    assertSame(RateUnit.bps, UnitTable.RATE_BITS.base());
    assertSame(RateUnit.Bps, UnitTable.RATE_BYTES.base());
    assertEquals(ImmutableList.of(RateUnit.kBps, RateUnit.kbps),
        UnitTable.of(ImmutableList.of(RateUnit.kbps, RateUnit.kBps)).descending());
  }

  @Test
  public void testUnitScales() {
    assertEquals(1024, SizeUnit.kB.multiplier(), 0);
    assertEquals(Math.pow(1024, 3), SizeUnit.GB.multiplier(), 0);
    assertEquals(3, SizeUnit.GB.exponent());
    assertEquals(1024, SizeUnit.GB.base());
    assertEquals(1e6, RateUnit.Mbps.multiplier(), 0);
    assertEquals(8e6, RateUnit.MBps.multiplier(), 0);
    assertEquals(2, RateUnit.MBps.exponent());
    assertEquals(1000, RateUnit.MBps.base());
    for (int i = 0; i < RateUnit.Family.BIT.units().size(); i++) {
      assertEquals(8 * RateUnit.Family.BIT.units().get(i).multiplier(),
          RateUnit.Family.BYTE.units().get(i).multiplier(), 0);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyTable() {
    UnitTable.of(ImmutableList.<SizeUnit>of());
  }
}

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

package com.bitunits.common.transfer;

import org.junit.Test;

import com.bitunits.common.duration.DurationFormatter;
import com.bitunits.common.quantity.Rate;
import com.bitunits.common.quantity.Size;
import com.bitunits.common.testing.easymock.EasyMockTest;

import static org.easymock.EasyMock.expect;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TransferCalculatorTest extends EasyMockTest {

  private static final double EPSILON = 1e-9;

  @Test
  public void testNominalTransferTime() {
    control.replay();

    TransferCalculator calculator = TransferCalculator.NOMINAL;
    assertEquals(80, calculator.transferTime(Size.gb(1), Rate.mbps(100)), EPSILON);
    assertEquals(160, calculator.transferTime(Size.gb(1), Rate.mbps(50)), EPSILON);
    assertEquals(320, calculator.transferTime(Size.gb(4), Rate.mbps(100)), EPSILON);
    assertEquals(640, calculator.transferTime(Size.gb(2), Rate.mbps(25)), EPSILON);
    assertEquals(12, calculator.transferTime(Size.mb(1.5), Rate.mbps(1)), EPSILON);
    assertEquals(80, calculator.transferTime(Size.gb(1), Rate.mBps(12.5)), EPSILON);
    assertEquals(0, calculator.transferTime(Size.of(0), Rate.mbps(1)), 0);
  }

  @Test
  public void testExactTransferTime() {
    control.replay();

    assertEquals(85.89934592,
        TransferCalculator.EXACT.transferTime(Size.gb(1), Rate.mbps(100)), EPSILON);
    assertEquals(8, TransferCalculator.EXACT.transferTime(Size.of(1000), Rate.kbps(1)), EPSILON);
  }

  @Test
  public void testConventions() {
    control.replay();

    assertEquals(8e9, TransferConvention.NOMINAL.bits(Size.gb(1)), 0);
    assertEquals(8589934592d, TransferConvention.EXACT.bits(Size.gb(1)), 0);
    assertEquals(800, TransferConvention.NOMINAL.bits(Size.of(100)), 0);
    assertEquals(Size.gb(1), TransferConvention.NOMINAL.size(8e9));
    assertEquals(Size.of(100), TransferConvention.NOMINAL.size(800));
    assertSame(TransferConvention.EXACT,
        new TransferCalculator(TransferConvention.EXACT).getConvention());
  }

  @Test
  public void testBandwidthTransferTime() {
    control.replay();

    assertEquals(102.4, TransferCalculator.NOMINAL.transferTime(Size.gb(1), 10485760), EPSILON);
    assertEquals(102.4, TransferCalculator.NOMINAL.transferTime(Size.gb(1), Size.mb(10)), EPSILON);
    assertEquals(102.4, Size.gb(1).getTransferTime("10 MB"), EPSILON);
    assertEquals(102.4, Size.gb(1).getTransferTime(10485760), EPSILON);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroRate() {
    control.replay();

    TransferCalculator.NOMINAL.transferTime(Size.gb(1), Rate.bps(0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroBandwidth() {
    control.replay();

    TransferCalculator.NOMINAL.transferTime(Size.gb(1), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeBandwidth() {
    control.replay();

    Size.gb(1).getTransferTime("-1 MB");
  }

  @Test
  public void testTransferAmount() {
    control.replay();

    TransferCalculator calculator = TransferCalculator.NOMINAL;
    assertEquals(Size.mb(750), calculator.transferAmount(Rate.mbps(100), 60));
    assertEquals(Size.gb(9), calculator.transferAmount(Rate.mbps(10), 7200));
    assertEquals(Size.gb(11.25), calculator.transferAmount(Rate.mbps(50), 1800));
    assertEquals(Size.gb(2.25), calculator.estimateFileSize(Rate.mbps(5), 3600));
    assertEquals("11.25 GB", calculator.transferAmount(Rate.mbps(50), 1800).humanize());
    assertEquals(Size.of(60000), calculator.transferAmount(1000, 60));
    assertEquals(Size.of(60000), calculator.estimateFileSize(1000, 60));
    assertEquals(Size.of(0), calculator.transferAmount(Rate.mbps(100), 0));
  }

  @Test
  public void testExactTransferAmount() {
    control.replay();

    TransferCalculator calculator = TransferCalculator.EXACT;
    assertEquals(Size.of(750000000), calculator.transferAmount(Rate.mbps(100), 60));
    assertEquals(Size.of(11250000000L), calculator.transferAmount(Rate.mbps(50), 1800));
    assertEquals(Size.of(2250000000L), calculator.estimateFileSize(Rate.mbps(5), 3600));
    assertEquals(Size.of(0), TransferConvention.EXACT.size(0));
  }

  @Test
  public void testAmountReadBackTakesOriginalTime() {
    control.replay();

    for (TransferCalculator calculator
        : new TransferCalculator[] {TransferCalculator.NOMINAL, TransferCalculator.EXACT}) {
      for (Rate rate : new Rate[] {Rate.mbps(50), Rate.kbps(128), Rate.gBps(1.5)}) {
        for (double seconds : new double[] {1, 60, 1800, 86400}) {
          Size amount = calculator.transferAmount(rate, seconds);
          assertEquals(calculator + " " + rate + " " + seconds, seconds,
              calculator.transferTime(amount, rate), seconds * EPSILON);
        }
      }
    }
    assertEquals(1800, Rate.mbps(50).calculateTransferTime(
        Rate.mbps(50).calculateTransferAmount(1800)), EPSILON);
  }

  @Test
  public void testNominalJumpsAtUnitBoundaries() {
    control.replay();

    assertEquals(8.184, TransferCalculator.NOMINAL.transferTime(Size.kb(1023), Rate.mbps(1)),
        EPSILON);
    assertEquals(8, TransferCalculator.NOMINAL.transferTime(Size.mb(1), Rate.mbps(1)), EPSILON);
    assertTrue(TransferCalculator.EXACT.transferTime(Size.kb(1023), Rate.mbps(1))
        < TransferCalculator.EXACT.transferTime(Size.mb(1), Rate.mbps(1)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeDuration() {
    control.replay();

    TransferCalculator.NOMINAL.transferAmount(Rate.mbps(100), -1);
  }

  @Test
  public void testFormattedTransferTime() {
    DurationFormatter formatter = createMock(DurationFormatter.class);
    expect(formatter.format(80, "de")).andReturn("1 Minute und 20 Sekunden");
    expect(formatter.format(85.89934592, null)).andReturn("1 minute, 25 seconds");
    control.replay();

    assertEquals("1 Minute und 20 Sekunden", TransferCalculator.NOMINAL
        .formattedTransferTime(Size.gb(1), Rate.mbps(100), formatter, "de"));
    assertEquals("1 minute, 25 seconds", TransferCalculator.EXACT
        .formattedTransferTime(Size.gb(1), Rate.mbps(100), formatter));
  }
}

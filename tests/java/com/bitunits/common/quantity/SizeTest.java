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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.collect.Range;
import com.google.common.testing.EqualsTester;

import org.junit.Test;

import com.bitunits.common.quantity.Quantity.DivisionByZeroException;
import com.bitunits.common.quantity.Quantity.Mode;
import com.bitunits.common.quantity.Quantity.NegativeQuantityException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SizeTest {

  @Test
  public void testHumanize() {
    assertEquals("1.5 kB", Size.of(1536).humanize());
    assertEquals("1.5 kB", Size.of(1536).toString());
    assertEquals("0 B", Size.of(0).humanize());
    assertEquals("512 B", Size.of(512).humanize());
    assertEquals("1 MB", Size.kb(1024).humanize());
    assertEquals("-1.5 kB", Size.of(-1536).humanize());
    assertEquals("1.5kB", Size.of(1536).humanize(2, ""));
    assertEquals("1.33 kB", Size.of(1365).humanize());
    assertEquals("1.333 kB", Size.of(1365).humanize(3, " "));
  }

  @Test
  public void testFactories() {
    assertEquals(1536, Size.of("1.5 kB").getValue(), 0);
    assertEquals(1610612736, Size.of("1.5 GB").getValue(), 0);
    assertEquals(2048, Size.of("2048").getValue(), 0);
    assertEquals(Size.gb(1), Size.fromUnit(1, "GB"));
    assertEquals(Size.gb(1), Size.fromUnit(1, SizeUnit.GB));
    assertEquals(Size.mb(1), Size.fromHumanReadable("1 mb"));
    assertEquals(Size.kb(1), Size.fromBits(8192));
    assertEquals(8192, Size.kb(1).toBits(), 0);
    assertEquals(Math.pow(1024, 8), Size.yb(1).getValue(), 0);
    assertEquals(1, Size.b(1).getValue(), 0);
  }

  @Test(expected = UnknownUnitException.class)
  public void testFromUnitUnknown() {
    Size.fromUnit(1, "XB");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNotFinite() {
    Size.of(Double.NaN);
  }

  @Test
  public void testConversion() {
    Size size = Size.of(1536);
    assertEquals(0.00146484375, size.getValue("MB"), 0);
    assertEquals(0.0015, size.getValue("MB", 4), 0);
    assertEquals(1.5, size.as(SizeUnit.kB), 0);
    assertEquals("1.5 kB", size.to("kB"));
    assertEquals("1536 B", size.to(SizeUnit.B));
    assertEquals("0 MB", size.toMb(0));
    assertEquals("1.5 kB", size.toKb(2));
    assertEquals("0.0015 MB", size.to("MB", 4));
    assertEquals("1.5_kB", size.to("kB", null, "_"));
    assertEquals("4 GB", Size.gb(4).toGb(null));
    assertEquals("0.5 TB", Size.gb(512).toTb(1));
  }

  @Test(expected = UnknownUnitException.class)
  public void testToUnknownUnit() {
    Size.kb(1).to("Mbps");
  }

  @Test
  public void testArithmetic() {
    assertEquals("3.5 GB", Size.gb(4).decrement("512 MB").humanize());
    assertEquals(Size.kb(2), Size.kb(1).increment(Size.kb(1)));
    assertEquals(Size.kb(2), Size.kb(1).increment("1 kB"));
    assertEquals(Size.kb(2), Size.kb(1).increment(1024));
    assertEquals(Size.of(512), Size.kb(1).decrement(512));
    assertEquals(Size.of(0), Size.kb(1).decrement(Size.kb(1)));
    assertEquals(Size.kb(2.5), Size.kb(1).multiply(2.5));
    assertEquals(Size.of(768), Size.of(1536).divide(2));
    assertEquals(Size.of(1.5), Size.of(1536).divide(Size.kb(1)));
    assertEquals(Size.of(1.5), Size.of(1536).divide("1 kB"));
    assertEquals(Size.of(512), Size.of(1536).modulo("1 kB"));
    assertEquals(Size.of(-512), Size.of(-1536).modulo(Size.kb(1)));
    assertEquals(Size.kb(1), Size.of(-1024).abs());
  }

  @Test
  public void testDecrementBelowZero() {
    try {
      Size.mb(1).decrement("2 MB");
      fail("expected a negative result to be rejected");
    } catch (NegativeQuantityException e) {
      // expected
    }
  }

  @Test(expected = DivisionByZeroException.class)
  public void testDivideByZero() {
    Size.kb(1).divide("0 B");
  }

  @Test(expected = DivisionByZeroException.class)
  public void testDivideByZeroScalar() {
    Size.kb(1).divide(0);
  }

  @Test(expected = DivisionByZeroException.class)
  public void testModuloByZero() {
    Size.kb(1).modulo(Size.of(0));
  }

  @Test
  public void testSign() {
    assertTrue(Size.of(0).isZero());
    assertTrue(Size.of(-0.0).isZero());
    assertTrue(Size.of(1).isPositive());
    assertTrue(Size.of(-1).isNegative());
    assertFalse(Size.of(0).isPositive());
  }

  @Test
  public void testCompare() {
    assertEquals(Quantity.COMPARE_EQ, Size.mb(1).compare("1024 kB"));
    assertEquals(Quantity.COMPARE_LT, Size.mb(1).compare("1 GB"));
    assertEquals(Quantity.COMPARE_GT, Size.mb(1).compare(Size.kb(1)));
    assertEquals(Quantity.COMPARE_GT, Size.mb(1).compare(1024));
    assertTrue(Size.mb(1).equalTo("1024 kB"));
    assertTrue(Size.mb(1).lessThan("2 MB"));
    assertTrue(Size.mb(1).lessThanOrEqual(Size.mb(1)));
    assertTrue(Size.mb(2).greaterThan(1048576));
    assertTrue(Size.mb(2).greaterThanOrEqual("2 MB"));
    assertFalse(Size.mb(2).greaterThan("2 MB"));
  }

  @Test
  public void testCompareSymmetry() {
    List<Size> sizes =
        ImmutableList.of(Size.of(0), Size.of(1), Size.kb(1), Size.of(1024), Size.gb(3));
    for (Size a : sizes) {
      assertTrue(a.equalTo(a));
      for (Size b : sizes) {
        assertEquals(a.compare(b), -b.compare(a));
        assertEquals(a.equalTo(b), b.equalTo(a));
      }
    }
  }

  @Test
  public void testCompareMany() {
    List<String> smaller = ImmutableList.of("1 MB", "512 kB");
    List<String> mixed = ImmutableList.of("1 MB", "3 MB");

    assertEquals(Optional.of(Quantity.COMPARE_GT), Size.mb(2).compare(smaller, Mode.ALL));
    assertEquals(Optional.<Integer>absent(), Size.mb(2).compare(mixed, Mode.ALL));
    assertEquals(Optional.of(Quantity.COMPARE_GT), Size.mb(2).compare(mixed, Mode.ANY));
    assertEquals(Optional.of(Quantity.COMPARE_EQ),
        Size.mb(1).compare(Arrays.<Object>asList(Size.mb(3), 1048576), Mode.ANY));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCompareNothing() {
    Size.mb(1).compare(Collections.emptyList(), Mode.ALL);
  }

  @Test
  public void testPredicatesMany() {
    Size size = Size.mb(1);
    assertTrue(size.lessThan(ImmutableList.of("2 MB", "3 MB"), Mode.ALL));
    assertTrue(size.lessThan(ImmutableList.of("512 kB", "2 MB"), Mode.ANY));
    assertFalse(size.lessThan(ImmutableList.of("512 kB", "2 MB"), Mode.ALL));
    assertTrue(size.equalTo(ImmutableList.of("1 MB", "1024 kB"), Mode.ALL));
    assertTrue(size.greaterThanOrEqual(Arrays.<Object>asList("1 MB", 12), Mode.ALL));
    assertFalse(size.lessThanOrEqual(ImmutableList.of("1 kB"), Mode.ANY));

    assertTrue(size.greaterThan(Collections.emptyList(), Mode.ALL));
    assertFalse(size.greaterThan(Collections.emptyList(), Mode.ANY));
  }

  @Test
  public void testMaxMin() {
    assertEquals(Size.mb(2), Size.mb(1).max("2 MB"));
    assertEquals(Size.mb(1), Size.mb(1).max(512));
    assertEquals(Size.of(512), Size.mb(1).min(512));
    assertEquals(Size.mb(2), Size.mb(1).max(Arrays.<Object>asList("2 MB", 512, Size.kb(1))));
    assertEquals(Size.of(512), Size.mb(1).min(Arrays.<Object>asList("2 MB", 512, Size.kb(1))));
  }

  @Test
  public void testBetween() {
    assertTrue(Size.mb(1).between("1 MB", "2 MB"));
    assertTrue(Size.mb(2).between("1 MB", "2 MB"));
    assertTrue(Size.mb(1).between(Size.mb(1), Size.mb(1)));
    assertFalse(Size.mb(3).between("1 MB", "2 MB"));
    assertFalse(Size.mb(1).between(Size.mb(2), Size.mb(1)));
    assertTrue(Size.kb(1).between(0, 1024));
  }

  @Test
  public void testInRanges() {
    List<Range<Size>> ranges = ImmutableList.of(
        Size.closedRange("0 B", "1 kB"),
        Size.closedRange("1 MB", "2 MB"));

    assertTrue(Size.mb(1.5).inRanges(ranges));
    assertTrue(Size.kb(1).inRanges(ranges, Mode.ANY));
    assertFalse(Size.mb(1.5).inRanges(ranges, Mode.ALL));
    assertFalse(Size.mb(3).inRanges(ranges));
  }

  @Test
  public void testRange() {
    assertEquals(ImmutableList.of(Size.mb(1), Size.mb(2), Size.mb(3)),
        Size.range("1 MB", "3 MB", "1 MB"));
    assertEquals(ImmutableList.of(Size.kb(1)), Size.range(Size.kb(1), Size.kb(1), Size.kb(1)));
    assertEquals(
        ImmutableList.of(Size.of(0), Size.of(0.1), Size.of(0.2), Size.of(0.30000000000000004)),
        Size.range("0", "0.35", "0.1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRangeInverted() {
    Size.range("3 MB", "1 MB", "1 MB");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRangeZeroStep() {
    Size.range("1 MB", "3 MB", "0 B");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRangeStepBelowResolution() {
    Size.range(Size.of(1e20), Size.of(1e20 + 1e6), Size.of(1));
  }

  @Test
  public void testAggregates() {
    List<String> sizes = ImmutableList.of("1 MB", "3 MB");
    assertEquals(Size.mb(4), Size.sum(sizes));
    assertEquals(Size.of(0), Size.sum(Collections.emptyList()));
    assertEquals(Size.mb(2), Size.average(sizes));
    assertEquals(Size.mb(3), Size.maximum(sizes));
    assertEquals(Size.mb(1), Size.minimum(sizes));
    assertEquals(Size.kb(1), Size.minimum(Arrays.<Object>asList(Size.gb(1), 1024, "1 MB")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAverageOfNothing() {
    Size.average(Collections.emptyList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMaximumOfNothing() {
    Size.maximum(Collections.emptyList());
  }

  @Test
  public void testRoundTrip() {
    Size size = Size.of(123456789);
    for (SizeUnit unit : SizeUnit.values()) {
      Size parsed = Size.of(size.to(unit));
      assertEquals(unit.symbol(), size.getValue(), parsed.getValue(), 1e-6);
    }
  }

  @Test
  public void testHumanizeIdempotent() {
    String humanized = Size.of(1610612736).humanize();
    assertEquals(humanized, Size.of(humanized).humanize());
  }

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(Size.kb(1), Size.of(1024), Size.of("1 kB"), Size.of("1024"))
        .addEqualityGroup(Size.of(0), Size.of(-0.0))
        .addEqualityGroup(Size.mb(1))
        .testEquals();
  }

  @Test
  public void testOrdering() {
    assertEquals(ImmutableList.of(Size.of(1), Size.kb(1), Size.mb(1)),
        Ordering.natural().sortedCopy(
            ImmutableList.of(Size.mb(1), Size.of(1), Size.kb(1))));
  }
}

/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.seqvec.vector;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import java.util.Arrays;

import static io.github.seqvec.vector.AbstractVector.INDEX_NOT_FOUND;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class TestIntVector extends RandomizedTest {

    private static void assertElements(IntVector v, int... expected) {
        assertEquals(expected.length, v.count());
        assertArrayEquals(expected, v.toArray());
    }

    private static boolean isPowerOfTwo(int x) {
        return x > 0 && (x & (x - 1)) == 0;
    }

    private IntVector randomVector(int size, int maxValue) {
        IntVector v = new IntVector();
        for (int i = 0; i < size; i++) {
            assertEquals(Status.OK, v.push(randomIntBetween(-maxValue, maxValue)));
        }
        return v;
    }

    @Test
    public void testBase() {
        IntVector v = new IntVector();
        assertTrue(v.isEmpty());
        assertEquals(0, v.capacity());

        assertEquals(Status.OK, v.appendItems(3, 2, 4, 1));
        assertFalse(v.isEmpty());
        assertElements(v, 3, 2, 4, 1);

        assertEquals(4, v.get(2));
        assertEquals(3, v.first());
        assertEquals(1, v.last());

        v.set(2, 5);
        assertElements(v, 3, 2, 5, 1);

        assertEquals(Status.OK, v.push(4));
        assertElements(v, 3, 2, 5, 1, 4);

        assertEquals(4, v.pop());
        assertElements(v, 3, 2, 5, 1);

        v.sort();
        assertElements(v, 1, 2, 3, 5);

        v.reverse();
        assertElements(v, 5, 3, 2, 1);

        assertEquals(Status.OK, v.insertAt(2, 4));
        assertElements(v, 5, 3, 4, 2, 1);

        assertEquals(3, v.removeAt(1));
        assertElements(v, 5, 4, 2, 1);

        assertEquals(Status.OK, v.insertAt(v.count(), 0));
        assertElements(v, 5, 4, 2, 1, 0);

        v.removeAll();
        assertTrue(v.isEmpty());
        assertEquals(8, v.capacity());
        v.close();
        assertEquals(0, v.capacity());
    }

    @Test
    public void testCapacity() {
        IntVector v = new IntVector();
        assertEquals(Status.OK, v.reserveCapacity(5));
        assertEquals(8, v.capacity());

        assertEquals(Status.OK, v.expand(3));
        assertEquals(8, v.capacity());
        assertEquals(Status.OK, v.expand(9));
        assertEquals(16, v.capacity());

        assertEquals(Status.OK, v.push(2));
        assertTrue(v.capacity() >= v.count());

        v.removeAll();
        assertEquals(0, v.count());

        assertEquals(Status.OK, v.shrink());
        assertEquals(0, v.capacity());

        assertEquals(Status.OK, v.push(1));
        assertEquals(2, v.capacity());
    }

    @Test
    public void testGrowthInvariant() {
        IntVector v = new IntVector();
        int n = randomIntBetween(1, 5000);
        for (int i = 0; i < n; i++) {
            int before = v.count();
            assertEquals(Status.OK, v.push(i));
            assertEquals(before + 1, v.count());
            assertTrue(v.capacity() >= v.count());
            assertTrue(isPowerOfTwo(v.capacity()));
        }
    }

    @Test
    public void testShrinkInvariant() {
        for (int trial = 0; trial < 50; trial++) {
            IntVector v = randomVector(randomIntBetween(0, 1000), 100);
            assertEquals(Status.OK, v.reserveCapacity(randomIntBetween(0, 4096)));
            int removals = randomIntBetween(0, v.count());
            for (int i = 0; i < removals; i++) {
                v.pop();
            }
            int[] before = v.toArray();
            assertEquals(Status.OK, v.shrink());
            if (v.count() == 0) {
                assertEquals(0, v.capacity());
            } else {
                assertTrue(isPowerOfTwo(v.capacity()));
                assertTrue(v.capacity() >= v.count());
                assertTrue(v.capacity() / 2 < v.count());
            }
            assertArrayEquals(before, v.toArray());
        }
    }

    @Test
    public void testInsertRemoveInverse() {
        IntVector v = randomVector(randomIntBetween(0, 200), 1000);
        for (int trial = 0; trial < 100; trial++) {
            int[] before = v.toArray();
            int i = randomIntBetween(0, v.count());
            int x = randomInt();
            assertEquals(Status.OK, v.insertAt(i, x));
            assertEquals(x, v.get(i));
            assertEquals(x, v.removeAt(i));
            assertArrayEquals(before, v.toArray());
        }
    }

    @Test
    public void testAppend() {
        IntVector v = IntVector.of(1, 2);
        assertEquals(Status.OK, v.appendArray(new int[] {9, 3, 4, 9}, 1, 2));
        assertElements(v, 1, 2, 3, 4);
        assertEquals(Status.OK, v.appendArray(null, 0));
        assertEquals(Status.OK, v.append(v));
        assertElements(v, 1, 2, 3, 4, 1, 2, 3, 4);
        assertEquals(8, v.capacity());
    }

    @Test
    public void testEquality() {
        IntVector v1 = IntVector.of(3, 2, 4, 1);

        IntVector v2 = v1.deepCopy(x -> x + 1);
        assertElements(v2, 4, 3, 5, 2);

        v2 = v1.copy();
        assertTrue(v1.contentEquals(v2));
        assertEquals(v1, v2);
        assertEquals(v1.hashCode(), v2.hashCode());

        int[] array = new int[v1.count()];
        v1.copyToArray(array);
        assertTrue(v1.contentEquals(IntVector.of(array)));

        v2.pop();
        assertFalse(v1.contentEquals(v2));

        v2.push(5);
        assertFalse(v1.contentEquals(v2));
        assertNotEquals(v1, v2);

        assertTrue(v1.contentEquals(v1));
        assertTrue(new IntVector().contentEquals(new IntVector()));
    }

    @Test
    public void testCopyIsIndependent() {
        IntVector v = randomVector(randomIntBetween(1, 100), 100);
        IntVector copy = v.copy();
        assertTrue(copy.contentEquals(v));
        copy.set(0, v.get(0) + 1);
        assertFalse(copy.contentEquals(v));
        copy.pop();
        copy.push(v.last());
        assertEquals(v.count(), copy.count());
    }

    @Test
    public void testContains() {
        IntVector v1 = IntVector.of(3, 2, 5, 4, 5, 1);

        assertEquals(2, v1.indexOf(5));
        assertEquals(4, v1.indexOfReverse(5));
        assertEquals(INDEX_NOT_FOUND, v1.indexOf(6));
        assertEquals(INDEX_NOT_FOUND, v1.indexOfReverse(6));

        assertTrue(v1.contains(2));
        assertFalse(v1.contains(7));

        IntVector v2 = IntVector.of(1, 6, 4, 5);
        assertFalse(v1.containsAll(v2));
        assertTrue(v1.containsAny(v2));

        assertTrue(v2.remove(6));
        assertFalse(v2.remove(6));
        assertFalse(v2.contains(6));
        assertTrue(v1.containsAll(v2));
        assertTrue(v1.containsAny(v2));

        v2.removeAll();
        v2.appendItems(6, 7, 8);
        assertFalse(v1.containsAny(v2));

        assertTrue(v1.containsAll(v1));
        assertTrue(v1.containsAny(v1));
    }

    @Test
    public void testUnique() {
        IntVector v1 = IntVector.of(3, 2, 4, 1);

        assertEquals(Status.ALREADY_PRESENT, v1.pushUnique(2));
        assertEquals(Status.OK, v1.pushUnique(5));
        assertElements(v1, 3, 2, 4, 1, 5);

        IntVector v2 = IntVector.of(2, 5, 6, 7);
        assertEquals(Status.OK, v1.appendUnique(v2));
        assertElements(v1, 3, 2, 4, 1, 5, 6, 7);

        v1.removeAllFrom(v2);
        assertElements(v1, 3, 4, 1);

        v1.removeAllFrom(v1);
        assertTrue(v1.isEmpty());
    }

    @Test
    public void testComparable() {
        IntVector v = new IntVector();
        assertEquals(INDEX_NOT_FOUND, v.indexOfMin());
        assertEquals(INDEX_NOT_FOUND, v.indexOfMax());

        assertEquals(Status.OK, v.insertSorted(0));
        assertElements(v, 0);
        v.removeAll();

        IntVector values = IntVector.of(3, 2, 2, 2, 4, 1, 5, 6, 5);

        v.append(values);
        assertEquals(5, v.indexOfMin());
        assertEquals(7, v.indexOfMax());

        v.sort();
        assertElements(v, 1, 2, 2, 2, 3, 4, 5, 5, 6);

        v.removeAll();
        v.append(values);
        v.sortRange(3, 3);
        assertElements(v, 3, 2, 2, 1, 2, 4, 5, 6, 5);

        v.removeAll();
        assertEquals(Status.OK, v.insertAllSorted(values));
        assertElements(v, 1, 2, 2, 2, 3, 4, 5, 5, 6);

        assertTrue(v.containsSorted(6));
        assertFalse(v.containsSorted(-1));
        assertFalse(v.containsSorted(7));
        assertEquals(4, v.indexOfSorted(3));
        assertEquals(1, v.indexOfSorted(2));
        assertEquals(INDEX_NOT_FOUND, v.indexOfSorted(7));

        v.removeAll();
        assertEquals(Status.OK, v.insertAllSortedUnique(values));
        assertElements(v, 1, 2, 3, 4, 5, 6);
        assertEquals(Status.ALREADY_PRESENT, v.insertSortedUnique(4));
        assertEquals(Status.OK, v.insertSortedUnique(0));
        assertElements(v, 0, 1, 2, 3, 4, 5, 6);

        assertEquals(Status.OK, v.insertAllSorted(v));
        assertElements(v, 0, 0, 1, 1, 2, 2, 3, 3, 4, 4, 5, 5, 6, 6);
    }

    @Test
    public void testMinMaxMatchSortedEnds() {
        for (int trial = 0; trial < 50; trial++) {
            IntVector v = randomVector(randomIntBetween(1, 500), 1000);
            int min = v.get(v.indexOfMin());
            int max = v.get(v.indexOfMax());
            v.sort();
            assertEquals(min, v.first());
            assertEquals(max, v.last());
        }
    }

    @Test
    public void testRandomSort() {
        for (int trial = 0; trial < 100; trial++) {
            IntVector v = randomVector(randomIntBetween(0, 3000), randomFrom(new Integer[] {3, 100, Integer.MAX_VALUE / 2}));
            int[] expected = v.toArray();
            Arrays.sort(expected);
            v.sort();
            assertArrayEquals(expected, v.toArray());
            for (int i = 1; i < v.count(); i++) {
                assertFalse(v.get(i) < v.get(i - 1));
            }
        }
    }

    @Test
    public void testInsertionIndexMatchesLinearLowerBound() {
        for (int cacheLine : new int[] {4, 16, 64, 256}) {
            VectorOptions options = VectorOptions.builder().withCacheLineSize(cacheLine).build();
            for (int trial = 0; trial < 30; trial++) {
                IntVector v = new IntVector(options);
                int n = randomIntBetween(0, 500);
                for (int i = 0; i < n; i++) {
                    v.push(randomIntBetween(0, 100));
                }
                v.sort();
                for (int probe = -2; probe <= 102; probe++) {
                    int expected = 0;
                    while (expected < v.count() && v.get(expected) < probe) {
                        expected++;
                    }
                    assertEquals("probe " + probe + " in " + v, expected, v.insertionIndexSorted(probe));
                }
            }
        }
    }

    @Test
    public void testInsertSortedKeepsOrder() {
        IntVector v = new IntVector();
        for (int i = 0; i < 1000; i++) {
            assertEquals(Status.OK, v.insertSorted(randomIntBetween(-50, 50)));
        }
        for (int i = 1; i < v.count(); i++) {
            assertTrue(v.get(i - 1) <= v.get(i));
        }
    }

    @Test
    public void testQsortAndReverse() {
        IntVector v = IntVector.of(3, 2, 4, 1);

        v.qsort(Integer::compare);
        assertElements(v, 1, 2, 3, 4);

        v.reverse();
        assertElements(v, 4, 3, 2, 1);

        v.qsortRange(1, 3, (a, b) -> Integer.compare(b, a));
        assertElements(v, 4, 3, 2, 1);

        v.qsortRange(0, 3, Integer::compare);
        assertElements(v, 2, 3, 4, 1);

        IntVector random = randomVector(randomIntBetween(0, 1000), 100);
        int[] expected = random.toArray();
        Arrays.sort(expected);
        random.qsort((a, b) -> Integer.compare(Math.abs(a - 1000), Math.abs(b - 1000)));
        int[] actual = random.toArray();
        for (int i = 0; i < actual.length; i++) {
            assertEquals(expected[expected.length - 1 - i], actual[i]);
        }
    }

    @Test
    public void testFirstIndexWhere() {
        IntVector v = IntVector.of(3, 2, 4, 1);
        assertEquals(2, v.firstIndexWhere(x -> x > 3));
        assertEquals(INDEX_NOT_FOUND, v.firstIndexWhere(x -> x > 5));

        int[] sum = new int[1];
        v.forEach(x -> sum[0] += x);
        assertEquals(10, sum[0]);
    }

    @Test
    public void testToString() {
        assertEquals("IntVector(3/4) [1, 2, 3]", IntVector.of(1, 2, 3).toString());
    }

    @Test
    public void testPredicateRemoval() {
        IntVector v = IntVector.of(3, 8, 2, 6, 5, 4);
        assertTrue(v.containsWhere(x -> x > 7));
        assertFalse(v.containsWhere(x -> x < 0));

        assertTrue(v.removeFirstWhere(x -> x % 2 == 0));
        assertElements(v, 3, 2, 6, 5, 4);
        assertFalse(v.removeFirstWhere(x -> x > 10));

        assertEquals(3, v.removeWhere(x -> x % 2 == 0));
        assertElements(v, 3, 5);
        assertEquals(8, v.capacity());

        assertEquals(0, v.removeWhere(x -> x > 10));
        assertEquals(2, v.removeWhere(x -> true));
        assertTrue(v.isEmpty());
    }
}

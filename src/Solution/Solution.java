package Solution;

import java.util.Arrays;

/**
 * Opaque solution buffer: {@code elementSize * size} bytes plus the logical
 * dimension {@code size} (number of cities, number of dimensions, ...).
 *
 * Engines never interpret the bytes; they only copy, hash and pass buffers to
 * the caller's strategies. The typed accessors below are for strategy authors
 * and use little-endian layout.
 *
 * Buffers are allocated once per run and reused with {@link #copyFrom(Solution)},
 * which never allocates.
 */
public class Solution
{
	public static final int INT_BYTES = Integer.BYTES;
	public static final int DOUBLE_BYTES = Double.BYTES;

	private final byte data[];
	private final int elementSize;
	private final int size;

	public Solution(int elementSize, int size)
	{
		if(elementSize <= 0 || size <= 0)
			throw new IllegalArgumentException("elementSize and size must be > 0");

		this.elementSize = elementSize;
		this.size = size;
		this.data = new byte[elementSize * size];
	}

	public static Solution ofInts(int size)
	{
		return new Solution(INT_BYTES, size);
	}

	public static Solution ofDoubles(int size)
	{
		return new Solution(DOUBLE_BYTES, size);
	}

	public void copyFrom(Solution reference)
	{
		if(reference.data.length != data.length)
			throw new IllegalArgumentException("Solution shapes differ: " + reference.data.length + " vs " + data.length);
		System.arraycopy(reference.data, 0, data, 0, data.length);
	}

	public Solution copy()
	{
		Solution copy = new Solution(elementSize, size);
		copy.copyFrom(this);
		return copy;
	}

	public boolean sameShape(Solution other)
	{
		return other != null && other.elementSize == elementSize && other.size == size;
	}

	public byte[] getData()
	{
		return data;
	}

	public int getElementSize()
	{
		return elementSize;
	}

	public int getSize()
	{
		return size;
	}

	public int getByteLength()
	{
		return data.length;
	}

//	-----------Typed accessors-----------

	public int getInt(int index)
	{
		int p = index * elementSize;
		return (data[p] & 0xFF)
				| (data[p + 1] & 0xFF) << 8
				| (data[p + 2] & 0xFF) << 16
				| (data[p + 3] & 0xFF) << 24;
	}

	public void setInt(int index, int value)
	{
		int p = index * elementSize;
		data[p] = (byte) value;
		data[p + 1] = (byte) (value >>> 8);
		data[p + 2] = (byte) (value >>> 16);
		data[p + 3] = (byte) (value >>> 24);
	}

	public double getDouble(int index)
	{
		int p = index * elementSize;
		long bits = 0;
		for(int b = 7; b >= 0; b--)
			bits = (bits << 8) | (data[p + b] & 0xFF);
		return Double.longBitsToDouble(bits);
	}

	public void setDouble(int index, double value)
	{
		int p = index * elementSize;
		long bits = Double.doubleToLongBits(value);
		for(int b = 0; b < 8; b++)
		{
			data[p + b] = (byte) bits;
			bits >>>= 8;
		}
	}

	public void swapInts(int i, int j)
	{
		int tmp = getInt(i);
		setInt(i, getInt(j));
		setInt(j, tmp);
	}

	public int[] toIntArray()
	{
		int values[] = new int[size];
		for(int i = 0; i < size; i++)
			values[i] = getInt(i);
		return values;
	}

	public void setInts(int values[])
	{
		for(int i = 0; i < size; i++)
			setInt(i, values[i]);
	}

	public double[] toDoubleArray()
	{
		double values[] = new double[size];
		for(int i = 0; i < size; i++)
			values[i] = getDouble(i);
		return values;
	}

	public void setDoubles(double values[])
	{
		for(int i = 0; i < size; i++)
			setDouble(i, values[i]);
	}

	public boolean contentEquals(Solution other)
	{
		return other != null && Arrays.equals(data, other.data);
	}

	@Override
	public String toString()
	{
		return "Solution[elementSize=" + elementSize + ", size=" + size + "]";
	}
}

package com.davfx.csvexport.csv;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.assertj.core.api.Assertions;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.base.Charsets;
import com.google.common.collect.Iterables;
import com.google.common.io.Files;
import com.google.common.primitives.Bytes;

public class CsvExportTest {
	
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	public static final class Store {
		private final String region;
		private final int sales;
		private final boolean open;
		public Store(String region, int sales, boolean open) {
			this.region = region;
			this.sales = sales;
			this.open = open;
		}
		public String getRegion() {
			return region;
		}
		public int getSales() {
			return sales;
		}
		public boolean isOpen() {
			return open;
		}
	}
	
	public record Shop(String region, int sales, LocalDateTime opened) {
	}
	
	public static final class City {
		public String name;
		public int population;
		public static final String COUNTRY = "none";
		public City(String name, int population) {
			this.name = name;
			this.population = population;
		}
	}
	
	public static final class Opaque {
		@SuppressWarnings("unused")
		private final String hidden = "hidden";
	}
	
	public static final class Broken {
		public String getValue() {
			throw new IllegalStateException("broken");
		}
	}

	private static CsvExport stores() {
		CsvExport csv = new CsvExport();
		
		csv.row();
		csv.set("Region", "New York, USA");
		csv.set("Sales", 100000);
		csv.set("Date Opened", LocalDateTime.of(2003, 12, 31, 0, 0, 0));
		
		csv.row();
		csv.set("Region", "Sydney \"in\" Australia");
		csv.set("Sales", 50000);
		csv.set("Date Opened", LocalDateTime.of(2005, 1, 1, 9, 30, 0));
		
		return csv;
	}

	@Test
	public void test() throws Exception {
		Assertions.assertThat(stores().export()).isEqualTo(""
				+ "Region,Sales,Date Opened\r\n"
				+ "\"New York, USA\",100000,2003-12-31\r\n"
				+ "\"Sydney \"\"in\"\" Australia\",50000,2005-01-01 09:30:00\r\n");
	}

	@Test
	public void testSeparatorHint() throws Exception {
		String csv = stores().export(new CsvFormat().withDelimiter(';').withSeparatorHint(true));
		Assertions.assertThat(csv.split("\r\n")).containsExactly(
				"sep=;",
				"Region;Sales;Date Opened",
				"New York, USA;100000;2003-12-31",
				"\"Sydney \"\"in\"\" Australia\";50000;2005-01-01 09:30:00");
	}

	@Test
	public void testWithoutHeader() throws Exception {
		String csv = stores().export(new CsvFormat().withHeader(false).withLineSeparator("\n"));
		Assertions.assertThat(csv).isEqualTo(""
				+ "\"New York, USA\",100000,2003-12-31\n"
				+ "\"Sydney \"\"in\"\" Australia\",50000,2005-01-01 09:30:00\n");
	}

	@Test
	public void testHeaderIsRawUnlessEscaped() throws Exception {
		CsvExport csv = new CsvExport();
		csv.row().set("a,b", 1).set("c", 2);
		Assertions.assertThat(Iterables.getFirst(csv.lines(new CsvFormat()), null)).isEqualTo("a,b,c");
		Assertions.assertThat(Iterables.getFirst(csv.lines(new CsvFormat().withEscapedHeader(true)), null)).isEqualTo("\"a,b\",c");
	}

	@Test
	public void testColumnOrder() throws Exception {
		CsvExport csv = new CsvExport();
		csv.row().set("A", 1);
		csv.row().set("B", 2);
		csv.row().set("A", 3).set("B", 4);
		Assertions.assertThat(csv.columns()).containsExactly("A", "B");
		Assertions.assertThat(csv.size()).isEqualTo(3);
		Assertions.assertThat(csv.lines(new CsvFormat())).containsExactly("A,B", "1,", ",2", "3,4");
	}

	@Test
	public void testSparseRows() throws Exception {
		CsvExport csv = new CsvExport();
		csv.row().set("A", "a1").set("B", "b1");
		csv.row().set("C", "c2");
		csv.row().set("B", "b3").set("A", null);
		Assertions.assertThat(csv.export(new CsvFormat().withLineSeparator("\n"))).isEqualTo("A,B,C\na1,b1,\n,,c2\n,b3,\n");
	}

	@Test
	public void testExportDoesNotModifyTable() throws Exception {
		CsvExport csv = new CsvExport();
		csv.row().set("A", 1);
		csv.row().set("B", 2);
		String first = csv.export();
		Assertions.assertThat(csv.export()).isEqualTo(first);
		Assertions.assertThat(csv.columns()).containsExactly("A", "B");
	}

	@Test
	public void testOverwrite() throws Exception {
		CsvExport csv = new CsvExport();
		csv.row().set("A", 1).set("A", 2);
		Assertions.assertThat(csv.lines(new CsvFormat().withHeader(false))).containsExactly("2");
	}

	@Test
	public void testEmpty() throws Exception {
		Assertions.assertThat(new CsvExport().export()).isEqualTo("\r\n");
		Assertions.assertThat(new CsvExport().export(new CsvFormat().withHeader(false))).isEmpty();
		Assertions.assertThat(new CsvExport().row().export(new CsvFormat().withHeader(false))).isEqualTo("\r\n");
	}

	@Test(expected = IllegalStateException.class)
	public void testSetBeforeRow() throws Exception {
		new CsvExport().set("A", 1);
	}

	@Test
	public void testLazyLines() throws Exception {
		CsvExport csv = stores();
		Iterable<String> lines = csv.lines(new CsvFormat());
		
		csv.row().set("Region", "Paris");
		
		Iterator<String> i = lines.iterator();
		Assertions.assertThat(i.next()).isEqualTo("Region,Sales,Date Opened");
		Assertions.assertThat(Iterables.getLast(lines)).isEqualTo("Paris,,");
		Assertions.assertThat(Iterables.size(lines)).isEqualTo(4);
	}

	@Test
	public void testBeans() throws Exception {
		CsvExport csv = new CsvExport();
		csv.add(Arrays.asList(new Store("New York, USA", 100000, true), new Store("Sydney", 50000, false)));
		Assertions.assertThat(csv.columns()).containsExactly("open", "region", "sales");
		Assertions.assertThat(csv.lines(new CsvFormat())).containsExactly("open,region,sales", "true,\"New York, USA\",100000", "false,Sydney,50000");
		
		csv.add(Collections.emptyList());
		Assertions.assertThat(csv.size()).isEqualTo(2);
	}

	@Test
	public void testRecords() throws Exception {
		CsvExport csv = new CsvExport();
		csv.add(Arrays.asList(new Shop("Paris", 3, LocalDateTime.of(2005, 1, 1, 9, 30, 0)), new Shop("Rome, Italy", 4, null)));
		Assertions.assertThat(csv.columns()).containsExactly("region", "sales", "opened");
		Assertions.assertThat(csv.lines(new CsvFormat())).containsExactly("region,sales,opened", "Paris,3,2005-01-01 09:30:00", "\"Rome, Italy\",4,");
	}

	@Test
	public void testPublicFields() throws Exception {
		CsvExport csv = new CsvExport();
		csv.add(Arrays.asList(new City("Lyon", 500000)));
		Assertions.assertThat(csv.columns()).containsExactlyInAnyOrder("name", "population");
		Assertions.assertThat(csv.export(new CsvFormat().withHeader(false))).isIn("Lyon,500000\r\n", "500000,Lyon\r\n");
	}

	@Test
	public void testNothingReadable() throws Exception {
		CsvExport csv = new CsvExport();
		try {
			csv.add(Arrays.asList(new Opaque()));
		} catch (CsvException e) {
			Assertions.assertThat(e.getMessage()).contains(Opaque.class.getName());
			Assertions.assertThat(csv.size()).isEqualTo(0);
			return;
		}
		Assertions.fail("Should fail without any readable field");
	}

	@Test
	public void testExtractor() throws Exception {
		CsvExport csv = new CsvExport();
		csv.add(Arrays.asList("b", "a"), new FieldExtractor<String>() {
			@Override
			public Map<String, Object> extract(String record) {
				Map<String, Object> m = new LinkedHashMap<>();
				m.put("value", record);
				m.put("length", record.length());
				return m;
			}
		});
		Assertions.assertThat(csv.lines(new CsvFormat())).containsExactly("value,length", "b,1", "a,1");
	}

	@Test
	public void testBrokenBean() throws Exception {
		CsvExport csv = new CsvExport();
		try {
			csv.add(Arrays.asList(new Broken()));
		} catch (CsvException e) {
			Assertions.assertThat(e.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("broken");
			return;
		}
		Assertions.fail("Should fail with a throwing getter");
	}

	@Test
	public void testToBytes() throws Exception {
		CsvExport csv = stores();
		byte[] text = csv.export().getBytes(Charsets.UTF_8);
		Assertions.assertThat(csv.toBytes()).isEqualTo(Bytes.concat(new byte[] { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF }, text));
		Assertions.assertThat(csv.toBytes(CsvEncoding.UTF_8_WITHOUT_BOM)).isEqualTo(text);
		Assertions.assertThat(csv.toBytes(CsvEncoding.UTF_16LE)).isEqualTo(Bytes.concat(new byte[] { (byte) 0xFF, (byte) 0xFE }, csv.export().getBytes(Charsets.UTF_16LE)));
	}

	@Test
	public void testFile() throws Exception {
		CsvExport csv = stores();
		File file = new File(folder.getRoot(), "test.csv");
		
		csv.export(file);
		Assertions.assertThat(Files.toByteArray(file)).isEqualTo(csv.toBytes());
		
		CsvFormat format = new CsvFormat().withDelimiter('\t').withSeparatorHint(true);
		csv.export(file, CsvEncoding.UTF_16LE, format);
		Assertions.assertThat(Files.toByteArray(file)).isEqualTo(csv.toBytes(CsvEncoding.UTF_16LE, format));
	}

	@Test
	public void testStream() throws Exception {
		CsvExport csv = stores();
		CsvFormat format = new CsvFormat().withDelimiter(';');
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		csv.export(out, CsvEncoding.ISO_8859_1, format);
		Assertions.assertThat(out.toByteArray()).isEqualTo(csv.toBytes(CsvEncoding.ISO_8859_1, format));
	}
}

package tech.andrefsramos.meal_scraper.adapters.outbound.sources;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.andrefsramos.meal_scraper.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.meal_scraper.adapters.outbound.http.HttpSession;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.domain.MenuDraft;
import tech.andrefsramos.meal_scraper.core.domain.MenuItem;
import tech.andrefsramos.meal_scraper.core.domain.MenuNormalizer;
import tech.andrefsramos.meal_scraper.core.domain.ServingDateResolver;
import tech.andrefsramos.meal_scraper.core.domain.SheetSection;
import tech.andrefsramos.meal_scraper.core.domain.SourceContent;
import tech.andrefsramos.meal_scraper.core.domain.exception.MenuParseException;
import tech.andrefsramos.meal_scraper.core.ports.MenuSourcePort;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Purpose

 * Weekly cafeteria spreadsheet published through the university iBook viewer (type "ibook-excel").

 * Fetch, one HttpSession so viewer cookies travel along:
 *  1) GET the viewer page and read "var bookcode = '...'".
 *  2) POST the file-list endpoint (key, bookcode, base64=N) and take the first <file> of the XML reply:
 *     its file_url, or https://{host}/contents/{b[0]}/{b[0..3]}/{bookcode}/raw/{name}.
 *  3) GET the spreadsheet bytes.
 * A file list without any <file> means nothing is published this week: empty content.

 * Parse, Apache POI over the first sheet:
 *  - Each configured SheetSection is a block of rows holding one provider's dishes for one slot.
 *  - Columns 1..dayColumns are Monday..; the date comes from dateRow when configured and readable,
 *    otherwise from the Monday-based week of the fetch date.
 *  - Blank cells and placeholders ("*복수메뉴*" plus target.ignoreItems) are dropped.
 */
@Component
public class IbookExcelMenuSourceAdapter implements MenuSourcePort {

    private static final Logger log = LoggerFactory.getLogger(IbookExcelMenuSourceAdapter.class);

    public static final String TYPE = "ibook-excel";
    static final String FILE_LIST_PATH = "/web/RawFileList";
    static final String LIBRARY_KEY = "kpu";
    static final List<String> PLACEHOLDERS = List.of("*복수메뉴*");

    private static final Pattern BOOKCODE = Pattern.compile("var\\s+bookcode\\s*=\\s*['\"]?([^'\";\\s]+)");
    private static final List<String> DEFAULT_CONTENT_TYPES = List.of(
            "application/vnd.openxmlformats-officedocument.spreadsheetml",
            "application/vnd.ms-excel",
            "application/octet-stream",
            "application/zip",
            "application/x-zip");

    private final Clock clock;
    private final Duration defaultTimeout;

    public IbookExcelMenuSourceAdapter(Clock clock, @Value("${app.crawl.fetch-timeout:PT20S}") Duration defaultTimeout) {
        this.clock = clock;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public boolean supports(CrawlTarget target) {
        return target != null && TYPE.equalsIgnoreCase(target.type());
    }

    @Override
    public SourceContent fetch(CrawlTarget target) {
        final long t0 = System.nanoTime();
        final String tid = target.id();
        final Instant fetchedAt = clock.instant();
        final HttpSession session = new HttpSession(tid, HttpFetch.timeoutOf(target, defaultTimeout));

        String viewer = session.get(target.url()).body();
        String bookcode = extractBookcode(viewer)
                .orElseThrow(() -> new MenuParseException(tid, "viewer page " + target.url(), "a 'var bookcode =' declaration"));
        log.info("[Source] target={} bookcode={}", tid, bookcode);

        String fileListUrl = (target.fileListUrl() == null || target.fileListUrl().isBlank())
                ? originOf(target.url()) + FILE_LIST_PATH : target.fileListUrl().trim();

        Map<String, String> form = new LinkedHashMap<>();
        form.put("key", LIBRARY_KEY);
        form.put("bookcode", bookcode);
        form.put("base64", "N");
        String fileListXml = session.post(fileListUrl, form).body();

        String fileUrl = resolveFileUrl(tid, fileListXml, bookcode);
        if (fileUrl == null) {
            log.info("[Source] target={} file list has no <file>, nothing published.", tid);
            return SourceContent.empty(tid, fileListUrl, null, fetchedAt);
        }

        Connection.Response file = session.get(fileUrl);
        SourceContent content = HttpFetch.toContent(target, fileUrl, file, DEFAULT_CONTENT_TYPES, fetchedAt);
        log.info("[Source] target={} spreadsheet downloaded url={} bytes={} tookMs={}ms",
                tid, fileUrl, content.body().length, (System.nanoTime() - t0) / 1_000_000);
        return content;
    }

    @Override
    public List<MenuDraft> parse(SourceContent content, CrawlTarget target) {
        final long t0 = System.nanoTime();
        final String tid = target.id();
        if (target.sections().isEmpty()) {
            throw new MenuParseException(tid, "target configuration", "at least one sheet section");
        }

        final LocalDate reference = SourceDates.referenceDate(content, clock);
        final int dayColumns = target.dayColumns() > 0 ? target.dayColumns() : 5;
        final Set<String> ignored = new LinkedHashSet<>(PLACEHOLDERS);
        ignored.addAll(target.ignoreItems());

        final List<MenuDraft> drafts = new ArrayList<>();
        try (Workbook wb = new XSSFWorkbook(new ByteArrayInputStream(content.body()))) {
            if (wb.getNumberOfSheets() == 0) {
                throw new MenuParseException(tid, "workbook", "at least one sheet");
            }
            Sheet sheet = wb.getSheetAt(0);
            DataFormatter fmt = new DataFormatter();

            List<LocalDate> dates = new ArrayList<>(dayColumns);
            for (int col = 1; col <= dayColumns; col++) {
                dates.add(dateOf(sheet, fmt, target.dateRow(), col, reference));
            }

            for (SheetSection section : target.sections()) {
                if (sheet.getLastRowNum() < section.firstRow()) {
                    throw new MenuParseException(tid, "rows " + section.firstRow() + ".." + section.lastRow(),
                            "a " + section.slot() + " block for provider " + section.providerId());
                }
                for (int col = 1; col <= dayColumns; col++) {
                    List<MenuItem> items = new ArrayList<>();
                    for (int r = section.firstRow(); r <= section.lastRow(); r++) {
                        String text = cellText(sheet.getRow(r), col, fmt);
                        for (String line : text.split("\\r?\\n")) {
                            MenuItem item = MenuNormalizer.parseItemLine(line);
                            if (!item.name().isEmpty()) items.add(item);
                        }
                    }
                    MenuNormalizer.draft(section.providerId(), dates.get(col - 1), section.slot(), items, ignored)
                            .ifPresent(drafts::add);
                }
            }
        } catch (MenuParseException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new MenuParseException(tid, "workbook", "a readable .xlsx spreadsheet", e);
        }

        log.info("[Source] target={} ibook-excel parsed: sections={} dayColumns={} drafts={} tookMs={}ms",
                tid, target.sections().size(), dayColumns, drafts.size(), (System.nanoTime() - t0) / 1_000_000);
        return drafts;
    }

    static Optional<String> extractBookcode(String html) {
        if (html == null) return Optional.empty();
        Matcher m = BOOKCODE.matcher(html);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** Download URL of the first listed file, or null when the list is empty. */
    static String resolveFileUrl(String targetId, String fileListXml, String bookcode) {
        Document xml = Jsoup.parse(fileListXml == null ? "" : fileListXml, "", Parser.xmlParser());
        Element file = xml.selectFirst("file");
        if (file == null) return null;

        String fileUrl = HttpFetch.sanit(file.attr("file_url"));
        if (!fileUrl.isEmpty()) return fileUrl;

        String host = HttpFetch.sanit(file.attr("host"));
        String name = HttpFetch.sanit(file.attr("name"));
        Element root = file.parent();
        String code = root != null && root.hasAttr("bookcode") ? HttpFetch.sanit(root.attr("bookcode")) : bookcode;
        if (host.isEmpty() || name.isEmpty() || code == null || code.length() < 3) {
            throw new MenuParseException(targetId, "file list <file>", "file_url, or host and name attributes");
        }
        return "https://" + host + "/contents/" + code.charAt(0) + "/" + code.substring(0, 3) + "/" + code + "/raw/" + name;
    }

    private static LocalDate dateOf(Sheet sheet, DataFormatter fmt, Integer dateRow, int col, LocalDate reference) {
        if (dateRow != null && dateRow >= 0) {
            Row row = sheet.getRow(dateRow);
            Cell cell = row == null ? null : row.getCell(col);
            if (cell != null) {
                if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate();
                }
                Optional<LocalDate> parsed = ServingDateResolver.resolve(fmt.formatCellValue(cell), reference);
                if (parsed.isPresent()) return parsed.get();
            }
            log.debug("[Source] date row {} column {} unreadable, using the week of {}", dateRow, col, reference);
        }
        return ServingDateResolver.weekdayOf(reference, col);
    }

    private static String cellText(Row row, int col, DataFormatter fmt) {
        if (row == null) return "";
        Cell cell = row.getCell(col);
        return cell == null ? "" : fmt.formatCellValue(cell);
    }

    private static String originOf(String url) {
        URI u = URI.create(url);
        return u.getScheme() + "://" + u.getRawAuthority();
    }
}

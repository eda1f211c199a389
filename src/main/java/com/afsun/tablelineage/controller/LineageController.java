package com.afsun.tablelineage.controller;

import com.afsun.tablelineage.config.LineageProperties;
import com.afsun.tablelineage.core.LineageResult;
import com.afsun.tablelineage.core.util.BteqScriptUtils;
import com.afsun.tablelineage.report.LineageReport;
import com.afsun.tablelineage.service.SqlLineageService;
import com.afsun.tablelineage.vo.BatchLineageResult;
import com.afsun.tablelineage.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import javax.annotation.Resource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQL表级血缘API控制器
 *
 * @author afsun
 * @date 2025-12-05日 15:30
 */
@RestController
@RequestMapping("/sql/lineage")
@Slf4j
public class LineageController {

    @Resource
    private SqlLineageService sqlLineageService;

    @Resource
    private LineageProperties lineageProperties;

    /**
     * 直接解析SQL文本
     *
     * @param sqlText SQL脚本文本
     * @param dialect 方言，为空时自动识别
     * @return 表级血缘
     */
    @PostMapping("/parse")
    public Response<LineageResult> parseText(@RequestBody String sqlText,
                                             @RequestParam(value = "dialect", required = false) String dialect) {
        checkText(sqlText);
        log.info("开始解析SQL文本，长度: {} 字符, 方言: {}", sqlText.length(), dialect);
        return Response.success(sqlLineageService.extract(sqlText, dialect));
    }

    /**
     * 上传脚本文件解析，.sh 文件先抽取其中的 BTEQ 代码块
     *
     * @param file SQL或BTEQ脚本文件（UTF-8编码）
     */
    @PostMapping("/upload")
    public Response<LineageResult> parseFile(@RequestParam("file") MultipartFile file,
                                             @RequestParam(value = "dialect", required = false) String dialect) {
        String content = readScript(file);
        log.info("开始解析SQL文件: {}, 大小: {} bytes", file.getOriginalFilename(), file.getSize());
        return Response.success(sqlLineageService.extract(content, dialect));
    }

    /**
     * 生成按表组织的血缘报告
     */
    @PostMapping("/report")
    public Response<LineageReport> report(@RequestBody String sqlText,
                                          @RequestParam(value = "dialect", required = false) String dialect,
                                          @RequestParam(value = "scriptName", defaultValue = "inline.sql") String scriptName) {
        checkText(sqlText);
        return Response.success(sqlLineageService.report(scriptName, sqlText, dialect));
    }

    /**
     * 批量上传解析，单个文件失败不影响其他文件
     */
    @PostMapping("/batch")
    public Response<BatchLineageResult> batch(@RequestParam("files") MultipartFile[] files,
                                              @RequestParam(value = "dialect", required = false) String dialect) {
        if (files == null || files.length == 0) {
            throw new IllegalArgumentException("文件列表不能为空");
        }
        Map<String, String> scripts = new LinkedHashMap<>();
        for (MultipartFile file : files) {
            scripts.put(file.getOriginalFilename(), readScript(file));
        }
        log.info("开始批量解析, 文件数: {}", scripts.size());
        return Response.success(sqlLineageService.extractBatch(scripts, dialect));
    }

    private void checkText(String sqlText) {
        if (StringUtils.isBlank(sqlText)) {
            throw new IllegalArgumentException("SQL文本不能为空");
        }
        if (sqlText.length() > lineageProperties.getMaxFileSize()) {
            throw new IllegalArgumentException(String.format("SQL文本长度超过限制：%d > %d",
                    sqlText.length(), lineageProperties.getMaxFileSize()));
        }
    }

    private String readScript(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("文件不能为空");
        }
        String filename = file.getOriginalFilename();
        if (StringUtils.isBlank(filename)) {
            throw new IllegalArgumentException("文件名无效");
        }
        if (file.getSize() > lineageProperties.getMaxFileSize()) {
            throw new IllegalArgumentException(String.format("文件大小超过限制：%.2fMB > %.2fMB",
                    file.getSize() / 1024.0 / 1024.0, lineageProperties.getMaxFileSize() / 1024.0 / 1024.0));
        }
        String content;
        try {
            content = new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("读取文件失败: " + filename, e);
        }
        if (StringUtils.endsWithIgnoreCase(filename, ".sh") || BteqScriptUtils.containsBteqBlock(content)) {
            log.debug("文件 {} 按 BTEQ 脚本抽取SQL", filename);
            return BteqScriptUtils.extractSql(content);
        }
        return content;
    }
}

package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.adapter.out.parser.SourceText;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.rule.ArchitectureRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Image optimization: raw {@code <img>} tags instead of {@code next/image},
 * and {@code <Image>} without alt text.
 * An {@code <img>} inside a string literal is reported too (false positive);
 * alt text passed through a props spread is not seen (false positive on the warning).
 */
@Component
public class ImageRule implements ArchitectureRule {
    
    static final String NAME = "image";
    
    private static final Pattern ALT = Pattern.compile("\\balt\\s*=");
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String description() {
        return "Images go through next/image with alt text";
    }
    
    @Override
    public boolean appliesTo(SourcePath path) {
        return path.isComponentFile();
    }
    
    @Override
    public RuleResult check(SourcePath path, String content, RuleOptions options) {
        String code = SourceText.stripComments(content);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        
        for (JsxTags.Tag img : JsxTags.find(code, "img")) {
            errors.add("Raw <img> tag on line " + SourceText.lineOf(code, img.offset())
                    + "; use the Image component from next/image");
        }
        for (JsxTags.Tag image : JsxTags.find(code, "Image")) {
            if (!ALT.matcher(image.attributes()).find()) {
                warnings.add("<Image> on line " + SourceText.lineOf(code, image.offset()) + " has no alt text");
            }
        }
        return RuleResult.of(errors, warnings);
    }
}

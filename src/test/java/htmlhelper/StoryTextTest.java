package htmlhelper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StoryTextTest {

    @Test
    public void readingsAreDropped() {
        assertEquals("亡くなった", StoryText.toText("<ruby>亡<rt>な</rt></ruby>くなった"));
        assertEquals("漢字", StoryText.toText("<ruby>漢<rp>(</rp><rt>かん</rt><rp>)</rp></ruby>字"));
        assertEquals("強い", StoryText.toText("<p><b><ruby>強<rtc>つよ</rtc></ruby></b>い</p>"));
    }

    @Test
    public void blocksAndBreaksBecomeLines() {
        String html = "<html><head><title>x</title></head><body>"
                + "<p>一<ruby>日<rt>にち</rt></ruby>目</p><p>上<br>下</p>"
                + "<script>var a = 1;</script></body></html>";

        assertEquals("一日目\n上\n下", StoryText.toText(html));
    }

    @Test
    public void linesAreTrimmedAndBlankLinesDropped() {
        assertEquals("a b", StoryText.toText("<div>  a \n\n  b  </div>"));
        assertEquals("前\n後", StoryText.toText("<div>前</div><div>&nbsp;</div><p></p><div>後&nbsp;</div>"));
    }

    @Test
    public void emptyInputGivesEmptyText() {
        assertEquals("", StoryText.toText(null));
        assertEquals("", StoryText.toText(""));
        assertEquals("", StoryText.toText("<p><rt>よみ</rt></p>"));
    }
}
